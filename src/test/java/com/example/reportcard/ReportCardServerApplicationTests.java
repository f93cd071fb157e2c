package com.example.reportcard;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ReportCardServerApplicationTests {

    @Test
    void contextLoads() {
    }

}
