package uz.greenwhite.delegation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class DelegationApplication {

    public static void main(String[] args) {
        SpringApplication.run(DelegationApplication.class, args);
    }
}
