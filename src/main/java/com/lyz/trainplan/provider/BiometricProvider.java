package com.lyz.trainplan.provider;

import com.lyz.trainplan.model.dto.readiness.DailyBiometrics;

import java.time.LocalDate;

/**
 * 生理数据源（外部设备平台）
 * 任意字段缺失属于正常情况；无数据时可返回 null
 */
public interface BiometricProvider {

    DailyBiometrics fetchDaily(LocalDate date);
}
