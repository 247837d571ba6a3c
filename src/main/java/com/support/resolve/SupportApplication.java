package com.support.resolve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 客服助理主應用程式
 * 提供工具層（工單、歷史紀錄、政策查詢、個資遮蔽）給語言模型協作者呼叫
 */
@SpringBootApplication
public class SupportApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupportApplication.class, args);
    }
}
