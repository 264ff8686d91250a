package com.convolab.server.controller;

import com.convolab.server.service.ConvolutionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConvolutionController.class)
@Import(ConvolutionService.class)
public class ConvolutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    public void testConvolveWithPreset() throws Exception {
        String body = "{\"input\": [[1,2,3,4],[5,6,7,8],[9,10,11,12],[13,14,15,16]],"
                + " \"preset\": \"identity\", \"kernelSize\": 3, \"stride\": 1, \"padding\": \"zero\","
                + " \"highlightStep\": 0}";

        mockMvc.perform(post("/convolve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputDimensions.height").value(4))
                .andExpect(jsonPath("$.outputDimensions.width").value(4))
                .andExpect(jsonPath("$.paddingValues.top").value(1))
                .andExpect(jsonPath("$.stepCount").value(16))
                .andExpect(jsonPath("$.steps", hasSize(16)))
                .andExpect(jsonPath("$.steps[0].row").value(-1))
                .andExpect(jsonPath("$.steps[0].inputPatch[1][1]").value(1.0))
                .andExpect(jsonPath("$.output[3][3]").value(16.0))
                .andExpect(jsonPath("$.highlight.height").value(3))
                .andExpect(jsonPath("$.highlight.paddedStartRow").value(0));
    }

    @Test
    public void testConvolveWithExplicitKernelWithoutSteps() throws Exception {
        String body = "{\"input\": [[1,1,1],[1,1,1],[1,1,1]], \"kernel\": [[1,1],[1,1]],"
                + " \"padding\": \"valid\", \"includeSteps\": false}";

        mockMvc.perform(post("/convolve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output[0][0]").value(4.0))
                .andExpect(jsonPath("$.stepCount").value(4))
                .andExpect(jsonPath("$.steps", hasSize(0)));
    }

    @Test
    public void testResolveAndApplyPadding() throws Exception {
        mockMvc.perform(post("/padding/resolve").contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputH\":4,\"inputW\":4,\"kernelH\":3,\"kernelW\":3,\"strideH\":2,\"strideW\":2,"
                        + "\"padding\":\"same\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.top").value(0))
                .andExpect(jsonPath("$.bottom").value(1));

        mockMvc.perform(post("/padding/apply").contentType(MediaType.APPLICATION_JSON)
                .content("{\"matrix\":[[1,2,3]],\"amounts\":{\"top\":0,\"bottom\":0,\"left\":1,\"right\":1},"
                        + "\"padding\":\"reflect\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]", hasSize(5)))
                .andExpect(jsonPath("$[0][0]").value(2.0))
                .andExpect(jsonPath("$[0][4]").value(2.0));
    }

    @Test
    public void testApplyPaddingRejectsHugeAmounts() throws Exception {
        mockMvc.perform(post("/padding/apply").contentType(MediaType.APPLICATION_JSON)
                .content("{\"matrix\":[[1,2],[3,4]],\"amounts\":{\"top\":2147483647,\"bottom\":1,\"left\":0,"
                        + "\"right\":0},\"padding\":\"zero\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/padding/apply").contentType(MediaType.APPLICATION_JSON)
                .content("{\"matrix\":[[1,2],[3,4]],\"amounts\":{\"top\":20000,\"bottom\":20000,"
                        + "\"left\":20000,\"right\":20000},\"padding\":\"reflect\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testKernelEndpoints() throws Exception {
        mockMvc.perform(get("/kernels"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(8)))
                .andExpect(jsonPath("$[0].key").value("identity"));

        mockMvc.perform(get("/kernels/box_blur").param("size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)))
                .andExpect(jsonPath("$[2][2]").value(0.04));

        mockMvc.perform(get("/kernels/box_blur").param("size", "4"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/kernels/laplace"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testConfigEndpoint() throws Exception {
        mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultPadding").value("valid"))
                .andExpect(jsonPath("$.maxKernelSize").value(15));
    }

    @Test
    public void testSamples() throws Exception {
        mockMvc.perform(get("/samples/checkerboard").param("size", "16"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(16)))
                .andExpect(jsonPath("$[0][0]").value(255.0));
    }

    @Test
    public void testRejectsMissingInputAndBadStride() throws Exception {
        mockMvc.perform(post("/convolve").contentType(MediaType.APPLICATION_JSON).content("{\"preset\":\"identity\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/convolve").contentType(MediaType.APPLICATION_JSON)
                .content("{\"input\": [[1,2],[3,4]], \"stride\": 0}"))
                .andExpect(status().isBadRequest());
    }
}
