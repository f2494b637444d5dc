package by.greenmobile.lotmassing;

import by.greenmobile.lotmassing.config.MassingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {MassingProperties.class})
@SpringBootApplication
public class LotMassingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LotMassingApplication.class, args);
    }

}
