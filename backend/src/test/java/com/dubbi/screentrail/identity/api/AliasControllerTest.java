package com.dubbi.screentrail.identity.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dubbi.screentrail.identity.service.Alias;
import com.dubbi.screentrail.identity.service.AliasIndex;
import com.dubbi.screentrail.identity.service.AliasSource;
import com.dubbi.screentrail.identity.service.ElementIdentity;
import com.dubbi.screentrail.identity.service.ElementSignature;
import com.dubbi.screentrail.identity.service.IdentityRegistry;
import com.dubbi.screentrail.persistence.PersistenceStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AliasController.class)
@Import(AliasControllerTest.RealAliasIndex.class)
class AliasControllerTest {
    private static final String ID = "0123456789abcdef0123456789abcdef";

    @TestConfiguration
    static class RealAliasIndex {
        @Bean
        AliasIndex aliasIndex() {
            return new AliasIndex(AliasIndex.DEFAULT_THRESHOLD);
        }
    }

    @Autowired
    MockMvc mvc;

    @Autowired
    AliasIndex aliasIndex;

    @MockBean
    IdentityRegistry identityRegistry;

    @MockBean
    PersistenceStore persistenceStore;

    private static ElementIdentity identity(String appId) {
        return new ElementIdentity(ID, appId, new ElementSignature("FrameLayout", "android.widget.Button", "tab_recent", "Recent", ""),
                null, Instant.parse("2026-01-05T09:00:00Z"));
    }

    @Test
    void resolveOnAppWithoutAliasesReturnsEmptyList() throws Exception {
        mvc.perform(get("/api/apps/com.example.empty/aliases/resolve").param("phrase", "recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phrase").value("recent"))
                .andExpect(jsonPath("$.candidates").isEmpty());
    }

    @Test
    void resolveReturnsRankedCandidatesWithDisplayName() throws Exception {
        aliasIndex.addAlias("recent", ID, "com.example.music", AliasSource.AUTO);
        when(identityRegistry.count("com.example.music")).thenReturn(1);
        when(identityRegistry.find(ID)).thenReturn(Optional.of(identity("com.example.music")));

        mvc.perform(get("/api/apps/com.example.music/aliases/resolve").param("phrase", "Recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.candidates[0].identityId").value(ID))
                .andExpect(jsonPath("$.candidates[0].displayName").value("Recent"))
                .andExpect(jsonPath("$.candidates[0].exact").value(true));
    }

    @Test
    void manualAliasIsIndexedAndPersisted() throws Exception {
        when(identityRegistry.count("com.example.notes")).thenReturn(1);
        when(identityRegistry.find(ID)).thenReturn(Optional.of(identity("com.example.notes")));

        mvc.perform(post("/api/apps/com.example.notes/aliases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phrase\":\"Latest stuff\",\"identityId\":\"" + ID + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phrase").value("latest stuff"))
                .andExpect(jsonPath("$.source").value("MANUAL"));

        verify(persistenceStore).flushAliases(eq("com.example.notes"),
                eq(List.of(new Alias("latest stuff", ID, "com.example.notes", AliasSource.MANUAL))));
    }

    @Test
    void aliasForUnknownIdentityIsNotFound() throws Exception {
        when(identityRegistry.find(anyString())).thenReturn(Optional.empty());

        mvc.perform(post("/api/apps/com.example.notes/aliases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phrase\":\"anything\",\"identityId\":\"missing\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void aliasForIdentityOfAnotherAppIsRejected() throws Exception {
        when(identityRegistry.find(ID)).thenReturn(Optional.of(identity("com.example.other")));

        mvc.perform(post("/api/apps/com.example.notes/aliases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phrase\":\"anything\",\"identityId\":\"" + ID + "\"}"))
                .andExpect(status().isBadRequest());
        verify(persistenceStore, never()).flushAliases(anyString(), any());
    }

    @Test
    void blankPhraseIsRejected() throws Exception {
        mvc.perform(post("/api/apps/com.example.notes/aliases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phrase\":\"   \",\"identityId\":\"" + ID + "\"}"))
                .andExpect(status().isBadRequest());
    }
}
