package com.exportscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Export scan: reconciles shipment demand against available export supply.
 */
@SpringBootApplication
public class ExportScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExportScanApplication.class, args);
    }
}
