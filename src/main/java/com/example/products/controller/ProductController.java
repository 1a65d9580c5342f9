package com.example.products.controller;

import com.example.products.model.MessageResponse;
import com.example.products.model.Product;
import com.example.products.service.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Product Controller, the last stage of the pipeline.
 *
 * By the time this method runs the request has already passed the
 * exception-handling and HTTPS-redirect stages, and the DispatcherServlet
 * has routed it here and converted {id} to an int. A non-numeric id never
 * reaches this class: the framework answers 400 through /error.
 *
 * Timeline:
 * [Request] → [Filters] → [Routing] → [getProduct] → [Jackson] → [Response]
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {

    private static final Logger log = LoggerFactory.getLogger(ProductController.class);

    static final String NOT_FOUND_MESSAGE = "Product not found.";

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    /**
     * Looks up one product.
     *
     * 200 with {"id", "name"} when found, 404 with {"message"} otherwise.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getProduct(@PathVariable int id) {
        String threadName = Thread.currentThread().getName();
        long startTime = System.currentTimeMillis();

        log.info("[{}] REQUEST START: GET /api/products/{}", threadName, id);

        Optional<Product> product = productService.findById(id);

        long duration = System.currentTimeMillis() - startTime;

        if (product.isEmpty()) {
            log.info("[{}] REQUEST END: 404 for id={} in {}ms", threadName, id, duration);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(MessageResponse.of(NOT_FOUND_MESSAGE));
        }

        log.info("[{}] REQUEST END: 200 for id={} in {}ms", threadName, id, duration);
        return ResponseEntity.ok(product.get());
    }
}
