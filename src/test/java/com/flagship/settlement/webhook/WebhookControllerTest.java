package com.flagship.settlement.webhook;

import com.flagship.settlement.config.JacksonConfig;
import com.flagship.settlement.exception.GlobalExceptionHandler;
import com.flagship.settlement.exception.InvalidSignatureException;
import com.flagship.settlement.observability.SettlementMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    private static final String BODY = "{\"id\":\"evt_1\"}";

    @Mock
    private WebhookReconciler reconciler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new WebhookController(reconciler, new SettlementMetrics(new SimpleMeterRegistry())))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .build();
    }

    @Test
    void verifiedDeliveryIsAcknowledged() throws Exception {
        when(reconciler.reconcile(BODY, "t=1,v1=abc"))
                .thenReturn(new WebhookReceipt("evt_1", "payment_intent.succeeded", WebhookOutcome.APPLIED));

        mockMvc.perform(post("/api/webhooks/payments")
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.event_type").value("payment_intent.succeeded"))
                .andExpect(jsonPath("$.outcome").value("applied"));
    }

    @Test
    void failedApplicationIsStillAcknowledged() throws Exception {
        when(reconciler.reconcile(anyString(), anyString()))
                .thenReturn(new WebhookReceipt("evt_1", "payment_intent.succeeded", WebhookOutcome.FAILED));

        mockMvc.perform(post("/api/webhooks/payments")
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("failed"));
    }

    @Test
    void badSignatureIsBadRequest() throws Exception {
        when(reconciler.reconcile(anyString(), isNull()))
                .thenThrow(new InvalidSignatureException("Signature header is missing"));

        mockMvc.perform(post("/api/webhooks/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SIGNATURE"));
    }
}
