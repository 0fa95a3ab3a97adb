package uk.gegc.scriptflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScriptFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptFlowApplication.class, args);
    }
}
