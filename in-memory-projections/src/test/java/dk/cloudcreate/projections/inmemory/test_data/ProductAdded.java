package dk.cloudcreate.projections.inmemory.test_data;

public class ProductAdded {
    public final String productKey;
    public final String category;

    public ProductAdded(String productKey, String category) {
        this.productKey = productKey;
        this.category = category;
    }

    @Override
    public String toString() {
        return "ProductAdded{" +
                "productKey='" + productKey + '\'' +
                ", category='" + category + '\'' +
                '}';
    }
}
