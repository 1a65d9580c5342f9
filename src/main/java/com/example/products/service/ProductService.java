package com.example.products.service;

import com.example.products.model.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * In-memory Product Service.
 *
 * The three products are created once when the bean is built and never
 * change afterwards, so concurrent requests need no coordination.
 *
 * In a real application this would be a repository call, e.g.
 * SELECT id, name FROM products WHERE id = ?
 */
@Service
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final List<Product> products = List.of(
        new Product(121, "Laptop"),
        new Product(122, "Phone"),
        new Product(123, "Headphones")
    );

    /**
     * Finds a product by id with a linear scan over the seed list.
     *
     * @param id Product ID to look up
     * @return the first matching product, or empty if none matches
     */
    public Optional<Product> findById(int id) {
        String threadName = Thread.currentThread().getName();

        log.debug("[{}] Scanning {} products for id={}", threadName, products.size(), id);

        Optional<Product> product = products.stream()
            .filter(p -> p.id() == id)
            .findFirst();

        log.debug("[{}] Lookup for id={} {}", threadName, id, product.isPresent() ? "hit" : "missed");

        return product;
    }
}
