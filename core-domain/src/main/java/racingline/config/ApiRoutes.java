package racingline.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/v1";

    // Rutas específicas
    public static final String OPTIMIZE = CURRENT_VERSION + "/optimize";
    public static final String MODELS = CURRENT_VERSION + "/models";
    public static final String TRACKS = CURRENT_VERSION + "/tracks";
}
