package me.growmies.assistant.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.growmies.assistant.domain.model.BillingMode;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {
    private String userId;
    private String guildId;
    private long balance;
    private long minimumBalance;
    private BillingMode billingMode;
}
