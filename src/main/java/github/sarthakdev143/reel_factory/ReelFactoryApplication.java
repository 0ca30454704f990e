package github.sarthakdev143.reel_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReelFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReelFactoryApplication.class, args);
	}

}
