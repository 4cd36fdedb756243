package com.example.notificationscheduler.realtime.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client to server frame. {@code register} carries a userId, {@code markAsRead} a notificationId.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {

    public static final String REGISTER = "register";
    public static final String MARK_AS_READ = "markAsRead";

    private String type;
    private String userId;
    private String notificationId;
}
