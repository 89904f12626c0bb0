package com.delta.domaincheck.check.api;

import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckRequest;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.DomainBatchResult;
import com.delta.domaincheck.check.model.LookupVerdict;
import com.delta.domaincheck.check.model.OverallProgress;
import com.delta.domaincheck.check.model.UnifiedBatchResult;
import com.delta.domaincheck.check.service.SingleDomainChecker;
import com.delta.domaincheck.check.service.UnifiedCheckService;
import com.delta.domaincheck.config.DomainCheckerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DomainCheckControllerTest {

    @Mock
    private SingleDomainChecker singleDomainChecker;

    @Mock
    private UnifiedCheckService unifiedCheckService;

    private DomainCheckerProperties properties;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        properties = new DomainCheckerProperties();
        properties.setExecutorThreads(8);
        properties.getApi().setMaxDomains(3);
        properties.getApi().setMaxTlds(4);
        properties.getApi().setMaxCombinations(6);
        properties.getApi().setMaxRetries(3);
        DomainCheckController controller = new DomainCheckController(singleDomainChecker, unifiedCheckService, properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new DomainCheckExceptionHandler())
            .build();
    }

    @Test
    void singleCheckReturnsVerdict() throws Exception {
        CheckResult taken = CheckResult.succeeded(new CheckRequest("example", ".com"), LookupVerdict.taken(), 1);
        when(singleDomainChecker.check(eq("example"), eq(".com"), any(CheckOptions.class))).thenReturn(taken);

        mockMvc.perform(post("/api/domain-check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"domain\":\"example\",\"tld\":\".com\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("example"))
            .andExpect(jsonPath("$.status").value("TAKEN"))
            .andExpect(jsonPath("$.attempts").value(1));
    }

    @Test
    void batchCheckPassesNormalizedInputAndClampedOverrides() throws Exception {
        when(unifiedCheckService.checkDomainsUnified(anyList(), anyList(), any(CheckOptions.class)))
            .thenReturn(emptyResult(List.of("alpha", "beta"), List.of(".com", ".net")));

        mockMvc.perform(post("/api/domain-checks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"names\":[\" alpha \",\"beta\",\"alpha\",\"\"],\"tlds\":[\".com\",\".net\"],"
                    + "\"maxConcurrency\":100,\"retries\":9,\"timeoutMs\":2500}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.domainNames[0]").value("alpha"))
            .andExpect(jsonPath("$.overallProgress.total").value(4))
            .andExpect(jsonPath("$.cancelled").value(false));

        ArgumentCaptor<CheckOptions> options = ArgumentCaptor.forClass(CheckOptions.class);
        verify(unifiedCheckService).checkDomainsUnified(
            eq(List.of("alpha", "beta")),
            eq(List.of(".com", ".net")),
            options.capture()
        );
        assertEquals(8, options.getValue().maxConcurrency());
        assertEquals(3, options.getValue().retries());
        assertEquals(2500L, options.getValue().timeoutMs());
    }

    @Test
    void batchCheckWithoutOverridesUsesConfiguredDefaults() throws Exception {
        when(unifiedCheckService.checkDomainsUnified(anyList(), anyList(), any(CheckOptions.class)))
            .thenReturn(emptyResult(List.of("alpha"), List.of(".com")));

        mockMvc.perform(post("/api/domain-checks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"names\":[\"alpha\"],\"tlds\":[\".com\"]}"))
            .andExpect(status().isOk());

        ArgumentCaptor<CheckOptions> options = ArgumentCaptor.forClass(CheckOptions.class);
        verify(unifiedCheckService).checkDomainsUnified(anyList(), anyList(), options.capture());
        assertThat(options.getValue().retries()).isEqualTo(properties.getRetries());
        assertThat(options.getValue().maxConcurrency()).isEqualTo(properties.getMaxConcurrency());
        assertThat(options.getValue().timeoutMs()).isEqualTo(properties.getLookup().getTimeoutMs());
    }

    @Test
    void missingNamesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/domain-checks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"names\":[\"  \"],\"tlds\":[\".com\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_check_request"))
            .andExpect(jsonPath("$.message").value("names and tlds are required"));

        verifyNoInteractions(unifiedCheckService);
    }

    @Test
    void tooManyCombinationsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/domain-checks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"names\":[\"a\",\"b\"],\"tlds\":[\".com\",\".net\",\".org\",\".io\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Too many combinations: 8 (max 6)"));

        verifyNoInteractions(unifiedCheckService);
    }

    @Test
    void tooManyNamesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/domain-checks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"names\":[\"a\",\"b\",\"c\",\"d\"],\"tlds\":[\".com\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Too many names: 4 (max 3)"));
    }

    private static UnifiedBatchResult emptyResult(List<String> names, List<String> tlds) {
        Instant now = Instant.now();
        int total = names.size() * tlds.size();
        Map<String, DomainBatchResult> byDomain = Map.of();
        return new UnifiedBatchResult(
            names,
            tlds,
            byDomain,
            OverallProgress.of(total, 0, 0, null, 0, names.size()),
            now,
            now,
            0L,
            false
        );
    }
}
