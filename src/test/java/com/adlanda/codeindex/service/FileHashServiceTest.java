package com.adlanda.codeindex.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileHashServiceTest {

    private FileHashService fileHashService;

    @BeforeEach
    void setUp() {
        fileHashService = new FileHashService();
    }

    @Test
    void computeHash_knownInput_returnsSha256Hex() {
        assertThat(fileHashService.computeHash("hello"))
                .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
    }

    @Test
    void computeHash_differentContent_returnsDifferentHash() {
        assertThat(fileHashService.computeHash("class A {}"))
                .isNotEqualTo(fileHashService.computeHash("class B {}"))
                .hasSize(64);
    }
}
