package com.pipeline.api.rest;

import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.engine.service.PipelineService;
import com.pipeline.engine.service.PipelineService.DispatchRequest;
import com.pipeline.engine.service.ShuttingDownException;
import com.pipeline.engine.service.TriggerRejectedException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkflowController.class)
@TestPropertySource(properties = "pipeline.default-branch=trunk")
class WorkflowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PipelineService pipelineService;

    @Test
    void listWorkflows_shouldDescribeTriggersAndJobs() throws Exception {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("deploy-pages")
            .version(3)
            .trigger(TriggerSpec.builder().events(Set.of("push")).branches(List.of("main"))
                .manualDispatch(true).build())
            .jobs(List.of(
                JobDefinition.builder().jobId("build")
                    .steps(List.of(StepDefinition.builder().run("npm ci").build())).build(),
                JobDefinition.builder().jobId("deploy").needs(Set.of("build"))
                    .steps(List.of(StepDefinition.builder().run("echo").build())).build()))
            .build();
        when(pipelineService.listWorkflows()).thenReturn(List.of(definition));

        mockMvc.perform(get("/api/v1/workflows"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("deploy-pages"))
            .andExpect(jsonPath("$[0].version").value(3))
            .andExpect(jsonPath("$[0].manualDispatch").value(true))
            .andExpect(jsonPath("$[0].jobs[1]").value("deploy"));
    }

    @Test
    void dispatch_withoutRef_shouldUseDefaultBranch() throws Exception {
        when(pipelineService.dispatch(any())).thenReturn(RunControllerTest.queuedRun(null));

        mockMvc.perform(post("/api/v1/workflows/{name}/dispatch", "deploy-pages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\": \"octo\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.state").value("QUEUED"));

        ArgumentCaptor<DispatchRequest> captor = ArgumentCaptor.forClass(DispatchRequest.class);
        verify(pipelineService).dispatch(captor.capture());
        assertThat(captor.getValue().ref()).isEqualTo("refs/heads/trunk");
        assertThat(captor.getValue().actor()).isEqualTo("octo");
        assertThat(captor.getValue().workflowName()).isEqualTo("deploy-pages");
    }

    @Test
    void dispatch_notEnabled_shouldReturn409() throws Exception {
        when(pipelineService.dispatch(any()))
            .thenThrow(new TriggerRejectedException("deploy-pages", "Manual dispatch is not enabled"));

        mockMvc.perform(post("/api/v1/workflows/{name}/dispatch", "deploy-pages"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value(TriggerRejectedException.ERROR_CODE));
    }

    @Test
    void dispatch_unknownWorkflow_shouldReturn404() throws Exception {
        when(pipelineService.dispatch(any())).thenThrow(new NotFoundException("WorkflowDefinition", "nope"));

        mockMvc.perform(post("/api/v1/workflows/{name}/dispatch", "nope"))
            .andExpect(status().isNotFound());
    }

    @Test
    void dispatch_duringShutdown_shouldReturn503() throws Exception {
        when(pipelineService.dispatch(any())).thenThrow(new ShuttingDownException());

        mockMvc.perform(post("/api/v1/workflows/{name}/dispatch", "deploy-pages"))
            .andExpect(status().isServiceUnavailable());
    }
}
