package org.rostilos.reviewpipe.reviewcli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.PrintStream;

@SpringBootApplication(scanBasePackages = {
        "org.rostilos.reviewpipe.reviewcli",
        "org.rostilos.reviewpipe.analysisengine"
})
public class ReviewCliApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ReviewCliApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(application.run(args)));
    }

    @Bean
    public PrintStream consoleOut() {
        return System.out;
    }
}
