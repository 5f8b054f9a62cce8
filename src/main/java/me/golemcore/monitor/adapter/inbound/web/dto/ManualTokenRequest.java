package me.golemcore.monitor.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManualTokenRequest {
    private String token;

    @Override
    public String toString() {
        return "ManualTokenRequest(token=***)";
    }
}
