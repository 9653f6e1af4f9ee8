package surfacetexture.io;

import lombok.extern.slf4j.Slf4j;
import surfacetexture.domain.exception.InputFormatException;
import surfacetexture.domain.profile.ProfileGrid;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Lee las alturas exportadas por el software Olympus LEXT.
 * <p>
 * El CSV de LEXT contiene todas las muestras en una única línea separada por comas (orden por filas).
 * Solo se lee la primera línea; los tokens vacíos se ignoran en lugar de tratarse como cero.
 */
@Slf4j
public class SurfaceCsvReader {

    private static final String DELIMITER = ",";

    /**
     * Lee las muestras de un fichero CSV.
     *
     * @param path Ruta del fichero.
     * @return Muestras en orden por filas (puede estar vacío si el fichero lo está).
     * @throws IOException           si el fichero no existe o no se puede leer.
     * @throws InputFormatException  si algún token no es numérico.
     */
    public double[] readSamples(Path path) throws IOException {
        log.info("Leyendo muestras de superficie desde {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        String firstLine;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            firstLine = reader.readLine();
        } catch (IOException e) {
            log.error("Error fatal al leer el archivo CSV desde {}", path.toAbsolutePath(), e);
            throw e;
        }

        double[] samples = parseSamples(firstLine == null ? "" : firstLine);
        log.debug("{} muestras leídas.", samples.length);
        return samples;
    }

    /**
     * Lee el fichero y construye directamente la rejilla primaria.
     *
     * @param allowTruncation Ver {@link ProfileGrid#fromSamples(double[], boolean)}.
     */
    public ProfileGrid readGrid(Path path, boolean allowTruncation) throws IOException {
        return ProfileGrid.fromSamples(readSamples(path), allowTruncation);
    }

    /**
     * Interpreta el contenido CSV ya cargado en memoria. Solo cuenta la primera línea.
     *
     * @throws InputFormatException si algún token no es numérico.
     */
    public double[] parseSamples(String content) {
        String line = content;
        int lineBreak = content.indexOf('\n');
        if (lineBreak >= 0) {
            line = content.substring(0, lineBreak);
        }

        String[] tokens = line.split(DELIMITER, -1);
        double[] samples = new double[tokens.length];
        int count = 0;

        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i].trim();
            if (token.isEmpty()) {
                continue;
            }
            try {
                samples[count++] = Double.parseDouble(token);
            } catch (NumberFormatException e) {
                throw new InputFormatException(i, token, e);
            }
        }
        return Arrays.copyOf(samples, count);
    }
}
