package me.growmies.assistant.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.growmies.assistant.domain.model.PreferencesUpdate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PreferencesUpdateRequest {
    private Boolean restrictedAssistanceEnabled;
    private String responseStyle;
    private Integer maxResponseLength;
    private String contentFilterLevel;
    private Boolean conversationHistoryEnabled;
    private Boolean useOwnApiKey;
    private String apiKey;

    public PreferencesUpdate toUpdate() {
        return PreferencesUpdate.builder()
                .restrictedAssistanceEnabled(restrictedAssistanceEnabled)
                .responseStyle(responseStyle)
                .maxResponseLength(maxResponseLength)
                .contentFilterLevel(contentFilterLevel)
                .conversationHistoryEnabled(conversationHistoryEnabled)
                .useOwnApiKey(useOwnApiKey)
                .apiKey(apiKey)
                .build();
    }
}
