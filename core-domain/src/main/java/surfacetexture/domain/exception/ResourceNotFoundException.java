package surfacetexture.domain.exception;

public class ResourceNotFoundException extends SurfaceAnalysisException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
