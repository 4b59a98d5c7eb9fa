package com.example.salesmart.ops;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.example.salesmart.discovery.Platform;
import com.example.salesmart.discovery.PlatformPolicy;
import com.example.salesmart.dto.discovery.DisabledPlatformsRequest;
import com.example.salesmart.exception.GlobalExceptionHandler;
import com.example.salesmart.repo.StateTransitionRepository;
import com.example.salesmart.service.StateTransitionService;

class OpsControllerTest {

    private final PlatformPolicy policy = mock(PlatformPolicy.class);
    private final SystemFlagService flags = mock(SystemFlagService.class);
    private final StateTransitionService transitions = mock(StateTransitionService.class);
    private final StateTransitionRepository transitionRepo = mock(StateTransitionRepository.class);
    private final OpsController controller = new OpsController(policy, flags, transitions, transitionRepo);

    @Test
    void platforms_reportsBothSets() {
        when(policy.enabledPlatforms()).thenReturn(EnumSet.of(Platform.LAZADA, Platform.TIKI));
        when(policy.disabledPlatforms()).thenReturn(EnumSet.of(Platform.SHOPEE));

        Map<String, Object> body = controller.platforms();

        assertEquals(EnumSet.of(Platform.LAZADA, Platform.TIKI), body.get("enabled"));
        assertEquals(EnumSet.of(Platform.SHOPEE), body.get("disabled"));
    }

    @Test
    void update_storesSortedTagsAndAudits() {
        when(policy.enabledPlatforms()).thenReturn(EnumSet.of(Platform.TIKI));
        when(policy.disabledPlatforms()).thenReturn(EnumSet.of(Platform.LAZADA, Platform.SHOPEE));

        ResponseEntity<Map<String, Object>> res = controller.updateDisabledPlatforms(
                new DisabledPlatformsRequest(List.of(Platform.SHOPEE, Platform.LAZADA, Platform.SHOPEE)));

        assertEquals(200, res.getStatusCode().value());
        verify(flags).set(PlatformPolicy.DISABLED_PLATFORMS_FLAG, "lazada,shopee");
        verify(transitions).log(eq("SYSTEM"), eq(0L), isNull(), eq("DISABLED_PLATFORMS_UPDATED"),
                eq("DISABLED_PLATFORMS_UPDATED"), eq("value=lazada,shopee"), eq("SYSTEM"), anyString());
    }

    @Test
    void update_emptyListEnablesEverything() {
        controller.updateDisabledPlatforms(new DisabledPlatformsRequest(List.of()));

        verify(flags).set(PlatformPolicy.DISABLED_PLATFORMS_FLAG, "");
    }

    @Test
    void runs_clampsLimit() {
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        when(transitionRepo.findRecentByEntity(eq(StateTransitionService.ENTITY_DISCOVERY_RUN), eq(4L), any()))
                .thenReturn(List.of());

        controller.recentRuns(4L, 500);
        controller.recentRuns(4L, 0);

        verify(transitionRepo, times(2)).findRecentByEntity(eq(StateTransitionService.ENTITY_DISCOVERY_RUN), eq(4L),
                page.capture());
        assertEquals(100, page.getAllValues().get(0).getPageSize());
        assertEquals(1, page.getAllValues().get(1).getPageSize());
    }

    @Test
    void update_nullEntryIsValidationError() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mvc.perform(put("/ops/discovery/platforms")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"disabled\": [\"shopee\", null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verify(flags, never()).set(anyString(), anyString());
        verifyNoInteractions(transitions);
    }
}
