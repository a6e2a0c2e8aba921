package com.hfm.budget.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Alert raised against a budget (overspent, approaching_limit, goal_reached). Recorded only;
 * delivery belongs to the notification service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BudgetAlert {

    private Long id;
    private Long budgetId;
    private Long userId;
    private String alertType;
    private String message;
    private LocalDateTime triggeredAt;
    private boolean read;
}
