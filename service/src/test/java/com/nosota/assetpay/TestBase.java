package com.nosota.assetpay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.assetpay.api.dto.AssetTransactionDTO;
import com.nosota.assetpay.api.request.CreateTransactionRequest;
import com.nosota.assetpay.api.response.PhaseResponse;
import com.nosota.assetpay.container.PostgresContainer;
import com.nosota.assetpay.registry.TransactionRegistry;
import com.nosota.assetpay.repository.AssetHoldRepository;
import com.nosota.assetpay.repository.AssetTransactionRepository;
import com.nosota.assetpay.support.TestTransactions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.net.URI;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Base class for integration tests against a real PostgreSQL instance.
 *
 * <p>Skipped when no Docker daemon is available.
 */
@SpringBootTest(
        classes = AssetpayApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.MOCK
)
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
public abstract class TestBase {

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected TransactionRegistry registry;

    @Autowired
    protected AssetTransactionRepository transactionRepository;

    @Autowired
    protected AssetHoldRepository holdRepository;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        PostgresContainer postgres = PostgresContainer.getInstance();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    /**
     * Records a new transaction through the REST API.
     */
    protected AssetTransactionDTO createTransaction(UUID transactionId) throws Exception {
        CreateTransactionRequest request = TestTransactions.createRequest(transactionId);
        String body = mockMvc.perform(post("/api/v1/asset-transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readValue(body, AssetTransactionDTO.class);
    }

    /**
     * Posts to a callback URI the way the ledger does.
     */
    protected PhaseResponse callBack(URI callbackUri) throws Exception {
        String body = mockMvc.perform(post(callbackUri))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readValue(body, PhaseResponse.class);
    }

    protected PhaseResponse callBack(UUID transactionId, String state) throws Exception {
        String body = mockMvc.perform(post("/assetpay/transaction")
                        .param("id", transactionId.toString())
                        .param("state", state))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readValue(body, PhaseResponse.class);
    }
}
