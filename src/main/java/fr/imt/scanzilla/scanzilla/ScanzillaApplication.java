package fr.imt.scanzilla.scanzilla;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableFeignClients(basePackages = "fr.imt.scanzilla.scanzilla")
public class ScanzillaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanzillaApplication.class, args);
    }

}
