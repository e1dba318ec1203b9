package org.politia.warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Politia Warehouse Loader.
 *
 * This application reads the JSON files produced by the OpenParlamento and WebTV fetchers
 * and loads them into the Politia warehouse, resolving transcript speakers to known
 * politicians along the way. The ingestion job runs on startup and the exit code
 * reflects its outcome.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PolitiaWarehouseLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(PolitiaWarehouseLoaderApplication.class, args)
        ));
    }
}
