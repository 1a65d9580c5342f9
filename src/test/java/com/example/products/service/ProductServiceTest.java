package com.example.products.service;

import com.example.products.model.Product;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProductService lookup")
class ProductServiceTest {

    private final ProductService productService = new ProductService();

    @ParameterizedTest(name = "id={0} -> {1}")
    @CsvSource({
        "121, Laptop",
        "122, Phone",
        "123, Headphones"
    })
    @DisplayName("seeded ids resolve to their product")
    void findById_seededId_returnsProduct(int id, String name) {
        assertThat(productService.findById(id)).contains(new Product(id, name));
    }

    @ParameterizedTest(name = "id={0}")
    @ValueSource(ints = {0, -1, 1, 120, 124, Integer.MAX_VALUE})
    @DisplayName("unknown ids resolve to empty")
    void findById_unknownId_returnsEmpty(int id) {
        assertThat(productService.findById(id)).isEmpty();
    }

    @Test
    @DisplayName("repeated lookups return equal, unchanged products")
    void findById_isReadOnly() {
        Product first = productService.findById(122).orElseThrow();
        Product second = productService.findById(122).orElseThrow();

        assertThat(second).isEqualTo(first);
        assertThat(second.name()).isEqualTo("Phone");
    }
}
