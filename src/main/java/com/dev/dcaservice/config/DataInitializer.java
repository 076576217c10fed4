package com.dev.dcaservice.config;

import com.dev.dcaservice.model.User;
import com.dev.dcaservice.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Seeds the operator account on application startup.
 */
@Configuration
public class DataInitializer {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  /**
   * Creates the configured admin user unless it already exists.
   */
  @Bean
  public CommandLineRunner initAdmin(UserRepository userRepository,
                                     PasswordEncoder passwordEncoder,
                                     @Value("${dca.admin.username}") String username,
                                     @Value("${dca.admin.password}") String password) {
    return args -> {
      if (userRepository.findByUsername(username).isPresent()) {
        log.info("Admin user {} already present, skipping", username);
        return;
      }
      userRepository.save(new User(username, passwordEncoder.encode(password), "ADMIN"));
      log.info("Created admin user {}", username);
    };
  }
}
