package com.phillippitts.freefleet;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@Tag("integration")
@SpringBootTest
class FreeFleetApplicationTests {

    @Test
    void contextLoads() {
    }

}
