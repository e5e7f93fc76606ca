package com.lyz.trainplan.model.dto;

import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 活动对账请求DTO
 */
@Data
public class ReconcileRequestDTO {

    /**
     * 调用方已拉取好的近期活动窗口
     */
    private List<RecordedActivity> activities = new ArrayList<>();
}
