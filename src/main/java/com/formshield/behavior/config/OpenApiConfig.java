package com.formshield.behavior.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI behaviorVerificationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Behavior Verification API")
                        .version("1.0.0")
                        .description(
                                "Challenge-free human verification for form submissions.\n\n" +
                                "**Session Pipeline:**\n" +
                                "1. Start a tracking session via `POST /sessions`\n" +
                                "2. Stream interaction events via `POST /sessions/{id}/events`\n" +
                                "3. Per-channel accumulators derive velocity, linearity, interval variance and pause features\n" +
                                "4. Channel scores (0-1) are fused into an overall score every tick\n" +
                                "5. Classification: **BOT** (<=0.3), **UNCERTAIN**, **HUMAN** (>=0.7)\n" +
                                "6. Anomaly flags (honeypot, automation markers, typing cadence) lower the human confidence\n" +
                                "7. `POST /sessions/{id}/decision` runs the ordered admission checks and returns allow/block\n\n" +
                                "**Channels:**\n" +
                                "- `POINTER`: velocity and acceleration variance, path linearity\n" +
                                "- `TOUCH`: swipe velocity variance, multi-touch\n" +
                                "- `CLICK`: inter-click interval variance and consistency\n" +
                                "- `KEYBOARD`: inter-keystroke variance and natural pauses\n" +
                                "- `TIMING`: delay before first interaction")
                        .contact(new Contact().name("Form Protection Team")));
    }
}
