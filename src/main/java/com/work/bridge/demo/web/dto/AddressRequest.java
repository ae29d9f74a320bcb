package com.work.bridge.demo.web.dto;

/**
 * 只携带一个地址的请求体；fee oracle / collector 传空或零地址表示关闭。
 */
public class AddressRequest {

    private String address;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
