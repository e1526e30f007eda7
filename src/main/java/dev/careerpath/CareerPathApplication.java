package dev.careerpath;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class CareerPathApplication implements CommandLineRunner {

  private final PipelineRunner pipelineRunner;
  private final ExitManager exitManager;

  public static void main(String[] args) {
    SpringApplication.run(CareerPathApplication.class, args);
  }

  @Override
  public void run(String... args) {
    try {
      pipelineRunner.execute();
      log.info("Career path analyzer exiting...");
      exitManager.exit(0);
    } catch (Exception e) {
      log.error("Career path analysis failed: {}", e.getMessage());
      exitManager.exit(1);
    }
  }
}
