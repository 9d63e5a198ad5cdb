package dk.cloudcreate.projections.test_data;

public class ProductDiscontinued {
    public final String productKey;

    public ProductDiscontinued(String productKey) {
        this.productKey = productKey;
    }
}
