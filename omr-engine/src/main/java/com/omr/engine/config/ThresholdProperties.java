package com.omr.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 气泡阈值判读相关配置。灰度单位均为 0-255。
 */
@Data
@ConfigurationProperties(prefix = "omr.threshold")
public class ThresholdProperties {

    /** 灰度上限 */
    public static final double MAX_INTENSITY = 255.0;

    /** 有意义的最小间隙：低于此值的间隙不认为能区分涂/未涂 */
    private double minJump = 25;

    /** 字段只有两个气泡时，两者之差低于此值则不做局部切分 */
    private double minGapTwoBubbles = 30;

    /** 局部阈值可信所需的额外间隙（在 minJump 之上） */
    private double minJumpSurplus = 5;

    /** 离群判定的标准差阈值：字段标准差低于此值视为无离群点 */
    private double outlierDeviationThreshold = 5;

    /** 样本不足时使用的默认阈值（灰度中值） */
    private double defaultThreshold = 127.5;

    /** 排序后扫描间隙的步长窗口，1 表示相邻两值 */
    private int lookahead = 1;

    /** 字段阈值计算方式 */
    private ThresholdMode mode = ThresholdMode.LOCAL;

    /** ADAPTIVE 模式下文件级阈值的权重 */
    private double globalWeight = 0.4;

    /** ADAPTIVE 模式下局部阈值的权重 */
    private double localWeight = 0.6;

    /** 未作答字段的输出值 */
    private String emptyValue = "";

    /** 字段（两个及以上气泡）全部被判为已涂时按未作答输出（通常是扫描问题） */
    private boolean allMarkedAsEmpty = true;

    /** 局部阈值的可信间隙 */
    public double confidentJump() {
        return minJump + minJumpSurplus;
    }

    public enum ThresholdMode {
        LOCAL, ADAPTIVE
    }
}
