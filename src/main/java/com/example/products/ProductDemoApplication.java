package com.example.products;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Product Demo Application
 *
 * This application traces a single GET request through the Spring MVC
 * pipeline and back out as JSON.
 *
 * The pipeline, outermost stage first:
 * 1. Exception handling - unhandled errors are forwarded to /error
 * 2. HTTPS redirect - plain HTTP is redirected when an HTTPS port is set
 * 3. Routing - DispatcherServlet picks the handler method
 * 4. Endpoint - ProductController runs and Jackson writes the body
 *
 * Watch the logs to see which thread handles each request.
 *
 * @see com.example.products.config.PipelineConfig
 * @see com.example.products.controller.ProductController
 */
@SpringBootApplication
public class ProductDemoApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔════════════════════════════════════════════════════════════════╗
            ║                     PRODUCT DEMO APPLICATION                   ║
            ╠════════════════════════════════════════════════════════════════╣
            ║  This app follows one GET request through the MVC pipeline.    ║
            ║                                                                ║
            ║  Endpoints:                                                    ║
            ║  • GET /api/products/{id}     - Lookup (try 121, 122, 123)     ║
            ║  • GET /error                 - Framework error route          ║
            ║                                                                ║
            ║  Metrics:                                                      ║
            ║  • GET /actuator/health       - Health check                   ║
            ║  • GET /actuator/prometheus   - Prometheus format              ║
            ╚════════════════════════════════════════════════════════════════╝
            """);

        SpringApplication.run(ProductDemoApplication.class, args);
    }
}
