package io.factorialsystems.federationserver.typehandler;

import com.fasterxml.jackson.core.type.TypeReference;
import io.factorialsystems.federationserver.model.Product;

import java.util.ArrayList;
import java.util.List;

public class ProductListTypeHandler extends JsonTypeHandler<List<Product>> {

    public ProductListTypeHandler() {
        super(new TypeReference<List<Product>>() {});
    }

    @Override
    protected List<Product> emptyValue() {
        return new ArrayList<>();
    }
}
