package dk.cloudcreate.projections.test_data;

public class ProductCatalogEntry {
    public final String id;
    public String       category;
    public int          numberOfChanges;

    public ProductCatalogEntry(String id) {
        this.id = id;
    }
}
