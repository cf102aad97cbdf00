package com.example.bpmn_transformer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BpmnTransformerApplication {

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(BpmnTransformerApplication.class);
		// options like --mode=mask belong to the transform command, not to the environment
		app.setAddCommandLineProperties(false);
		System.exit(SpringApplication.exit(app.run(args)));
	}

}
