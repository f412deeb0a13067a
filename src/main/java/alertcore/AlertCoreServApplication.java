package alertcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertCoreServApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertCoreServApplication.class, args);
    }

}
