package info.mouts.restaurantservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RestaurantOrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestaurantOrderServiceApplication.class, args);
    }
}
