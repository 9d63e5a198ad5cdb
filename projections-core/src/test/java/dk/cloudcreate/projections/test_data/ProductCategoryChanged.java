package dk.cloudcreate.projections.test_data;

public class ProductCategoryChanged {
    public final String productKey;
    public final String category;

    public ProductCategoryChanged(String productKey, String category) {
        this.productKey = productKey;
        this.category = category;
    }
}
