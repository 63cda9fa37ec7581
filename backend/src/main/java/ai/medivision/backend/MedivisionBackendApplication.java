package ai.medivision.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedivisionBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedivisionBackendApplication.class, args);
    }

}
