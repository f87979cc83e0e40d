package com.stylematch;

import com.stylematch.spring.EnableStyleValidation;
import com.stylematch.validation.StyleValidationResult;
import com.stylematch.validation.StyleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Spring Boot application validating declarations given on the command line.
 * <p>
 * Each argument is one {@code name: value} declaration, e.g.
 * {@code "border-width: 1px 2px"}. Without arguments a few sample
 * declarations are validated.
 */
@SpringBootApplication
@EnableStyleValidation
public class StyleMatchApplication {

    private static final Logger log = LoggerFactory.getLogger(StyleMatchApplication.class);

    private static final List<String> SAMPLE_DECLARATIONS = List.of(
            "width: 10px",
            "width: 10",
            "color: notacolor",
            "margin: 1px 2px 3px 4px 5px",
            "colour: red",
            "flex: 1 0 auto",
            "background-color: var(--accent)"
    );

    public static void main(String[] args) {
        SpringApplication.run(StyleMatchApplication.class, args);
    }

    @Bean
    public CommandLineRunner validateDeclarations(StyleValidator validator) {
        return args -> {
            List<String> declarations = args.length > 0 ? List.of(args) : SAMPLE_DECLARATIONS;
            int failures = 0;

            for (String declaration : declarations) {
                int separator = declaration.indexOf(':');
                if (separator < 0) {
                    log.warn("Skipping '{}': expected 'name: value'", declaration);
                    failures++;
                    continue;
                }

                String name = declaration.substring(0, separator).trim();
                String value = declaration.substring(separator + 1).trim();
                StyleValidationResult result = validator.validateProperty(name, value);

                switch (result.status()) {
                    case OK -> log.info("OK       {}: {}", name, value);
                    case WARNING -> log.warn("WARNING  {}: {} -> {}", name, value, result.message());
                    case ERROR -> {
                        failures++;
                        if (result.hint() != null) {
                            log.error("ERROR    {}: {} -> {} ({})", name, value, result.message(), result.hint());
                        } else {
                            log.error("ERROR    {}: {} -> {}", name, value, result.message());
                        }
                    }
                }
            }

            log.info("Validated {} declarations, {} with errors", declarations.size(), failures);
        };
    }
}
