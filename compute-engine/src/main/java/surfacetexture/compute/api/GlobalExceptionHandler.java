package surfacetexture.compute.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import surfacetexture.domain.exception.CutoffUnreachableException;
import surfacetexture.domain.exception.DegenerateRowException;
import surfacetexture.domain.exception.InputFormatException;
import surfacetexture.domain.exception.InputShapeException;
import surfacetexture.domain.exception.InvalidParameterException;
import surfacetexture.domain.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Entrada inválida (muestras no cuadradas, tokens no numéricos, parámetros fuera de rango,
     * cuerpo o parámetros de ruta ilegibles).
     * Log: WARN (error del cliente, no del sistema).
     * <p>
     * Los IllegalArgumentException sueltos son invariantes internos rotos y acaban en el 500.
     */
    @ExceptionHandler({InputShapeException.class, InputFormatException.class, InvalidParameterException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Object> handleInvalidInput(Exception ex) {
        log.warn("Invalid Input: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid Surface Input", ex.getMessage());
    }

    /**
     * Configuración del filtro imposible para la superficie recibida.
     * Log: WARN.
     */
    @ExceptionHandler({CutoffUnreachableException.class, DegenerateRowException.class})
    public ResponseEntity<Object> handleFilterConfiguration(RuntimeException ex) {
        log.warn("Filter Configuration Error: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Filter Configuration", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource Not Found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Decomposition not found", ex.getMessage());
    }

    /**
     * Maneja todo lo demás.
     * Log: ERROR (Incluye StackTrace completo).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
