package tasktree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the task tree service.
 */
@SpringBootApplication
public class TaskTreeApplication {

    public static void main(final String[] args) {
        SpringApplication.run(TaskTreeApplication.class, args);
    }
}
