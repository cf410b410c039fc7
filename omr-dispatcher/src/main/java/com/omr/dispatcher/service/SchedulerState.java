package com.omr.dispatcher.service;

/**
 * 批次调度的阶段。
 */
public enum SchedulerState {
    /** 校验参数、清空计数 */
    INIT,
    /** 每个文件提交一个任务到工作线程池 */
    DISPATCHING,
    /** 按完成顺序收集结果（成功或失败） */
    COLLECTING,
    /** 按 inputIndex 排序 */
    REORDERING,
    /** 按顺序输出 */
    DONE
}
