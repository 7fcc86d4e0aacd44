package com.sandy.esl.tracker.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorRsp {
    private String code;
    private String error;
    /** Status answered by the Parse server, only for platform errors. */
    private Integer upstreamStatus;
}
