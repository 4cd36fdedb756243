package com.example.notificationscheduler.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class PingController {

    @GetMapping("/ping")
    @Operation(summary = "Liveness check")
    public String ping() {
        return "pong";
    }
}
