package com.lyz.trainplan.service;

import com.lyz.trainplan.model.dto.ReadinessRequestDTO;
import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.provider.BiometricProvider;

import java.time.LocalDate;

public interface ReadinessService {

    /**
     * 根据已有读数评估就绪度，缺失读数不会导致失败
     *
     * @param inputs 读数
     * @return 就绪度快照
     */
    ReadinessSnapshot evaluate(BiometricInputs inputs);

    /**
     * 从数据源拉取今天与昨天的读数后评估
     *
     * @param provider 调用方注入的数据源
     * @param date     评估日期
     * @return 就绪度快照，数据源异常时按无数据评估
     */
    ReadinessSnapshot getTodayReadiness(BiometricProvider provider, LocalDate date);

    /**
     * 请求DTO -> 评估输入，日期缺省为当天
     */
    BiometricInputs toInputs(ReadinessRequestDTO dto);
}
