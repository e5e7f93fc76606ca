package com.lyz.trainplan.model.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaterializeResultVO {
    private Long planId;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer taskCount;
}
