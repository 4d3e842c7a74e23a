package forensic.damages;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class DamagesApplication {

  public static void main(String[] args) {
    SpringApplication.run(DamagesApplication.class, args);
  }
}
