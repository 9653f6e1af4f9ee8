package surfacetexture.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/v1";

    // Rutas específicas
    public static final String SURFACES = CURRENT_VERSION + "/surfaces";
}
