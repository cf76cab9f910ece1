package info.mouts.foodorders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoodOrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoodOrderServiceApplication.class, args);
    }
}
