/*
 * Where: crafting application entry point
 * What: Boots Spring, binds configuration records and enables the session sweep schedule
 */
package com.guildcraft.crafting;

import com.guildcraft.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class CraftingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CraftingApplication.class, args);
    }
}
