package com.southern.keysync.controller;

import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.common.exception.GlobalExceptionHandler;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.service.MasterKeyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;

@WebMvcTest(MasterKeyController.class)
@Import(GlobalExceptionHandler.class)
class MasterKeyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MasterKeyService masterKeyService;

    @Test
    void listFiltersByStatus() throws Exception {
        when(masterKeyService.listMasterKeys("active")).thenReturn(Collections.singletonList(
                MasterKeyRecord.builder().masterKeyId(1L).masterKey("K4").status("active").build()));

        mockMvc.perform(get("/api/master-keys/list").param("status", "active"))
                .andExpect(jsonPath("$.code").value(1))
                .andExpect(jsonPath("$.data[0].masterKey").value("K4"));
    }

    @Test
    void approveReturnsActivatedCount() throws Exception {
        when(masterKeyService.approve(3L)).thenReturn(2);

        mockMvc.perform(post("/api/master-keys/approve/3"))
                .andExpect(jsonPath("$.code").value(1))
                .andExpect(jsonPath("$.data").value(2));
    }

    @Test
    void deprecateTwiceIsBusinessError() throws Exception {
        doThrow(new BusinessException("Master key 5 is already deprecated"))
                .when(masterKeyService).deprecate(5L);

        mockMvc.perform(post("/api/master-keys/deprecate/5"))
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.msg").value("Master key 5 is already deprecated"));
        verify(masterKeyService).deprecate(5L);
    }
}
