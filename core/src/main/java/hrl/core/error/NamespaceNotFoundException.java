package hrl.core.error;

public class NamespaceNotFoundException extends RateLimiterException {

    private final String namespace;

    public NamespaceNotFoundException(String namespace) {
        super("Namespace not found: " + namespace);
        this.namespace = namespace;
    }

    public String namespace() {
        return namespace;
    }
}
