package com.studyprep.api.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EntityScan("com.studyprep.data.entity")
@EnableJpaRepositories("com.studyprep.data.repository")
public class JpaConfig {
}
