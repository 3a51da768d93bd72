package kds.dal;

/**
 * Location of the printer/assignment catalog JSON
 * @since 04/10/2026
 */
public record CatalogConfig(String path) {

    public void validate() throws ConfigurationException {
        if (path == null || path.trim().isEmpty()) {
            throw new ConfigurationException("Catalog path cannot be empty");
        }
    }
}
