package me.golemcore.monitor.adapter.inbound.web.dto;

import me.golemcore.monitor.domain.model.ServiceError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceErrorDto {
    private String kind;
    private String message;
    private Integer httpStatus;
    private String detail;
    private String recoverySuggestion;

    public static ServiceErrorDto from(ServiceError error) {
        if (error == null) {
            return null;
        }
        return ServiceErrorDto.builder()
                .kind(error.getKind().name())
                .message(error.getMessage())
                .httpStatus(error.getHttpStatus())
                .detail(error.getDetail())
                .recoverySuggestion(error.getRecoverySuggestion())
                .build();
    }
}
