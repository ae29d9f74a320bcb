package com.work.bridge.demo.web.dto;

/**
 * 批量处理接下来的 count 个 relocation。
 */
public class RelocateRequest {

    private int count;

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }
}
