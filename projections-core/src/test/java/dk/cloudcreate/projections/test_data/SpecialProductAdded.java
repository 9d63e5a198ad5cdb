package dk.cloudcreate.projections.test_data;

public class SpecialProductAdded extends ProductAdded {
    public SpecialProductAdded(String productKey, String category) {
        super(productKey, category);
    }
}
