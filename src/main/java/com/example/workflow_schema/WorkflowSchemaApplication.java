package com.example.workflow_schema;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowSchemaApplication {

	public static void main(String[] args) {
		SpringApplication.run(WorkflowSchemaApplication.class, args);
	}

}
