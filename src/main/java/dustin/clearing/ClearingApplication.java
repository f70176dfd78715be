package dustin.clearing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClearingApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClearingApplication.class, args);
	}

}
