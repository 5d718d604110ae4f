package org.filest.web;

import com.jayway.jsonpath.JsonPath;
import org.filest.filesystem.FileServerProperties;
import org.filest.filesystem.SandboxPathResolver;
import org.filest.upload.ChunkedUploadService;
import org.filest.upload.DirectUploadService;
import org.filest.upload.UploadSessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class UploadControllerTest {

    @TempDir
    Path tmp;

    private Path root;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        FileServerProperties properties = new FileServerProperties();
        properties.setRoot(tmp.resolve("root").toString());
        properties.setScratchDir(tmp.resolve("scratch"));
        SandboxPathResolver resolver = new SandboxPathResolver(properties);
        root = resolver.root();

        UploadController controller = new UploadController(
                new ChunkedUploadService(resolver, new UploadSessionStore(), properties, Clock.systemUTC()),
                new DirectUploadService(resolver, properties));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new UploadExceptionHandler())
                .build();
    }

    @Test
    void multipartUpload_savesFilesUnderPath() throws Exception {
        mockMvc.perform(multipart("/api/upload")
                        .file(new MockMultipartFile("files", "a.txt", "text/plain", "alpha".getBytes(StandardCharsets.UTF_8)))
                        .file(new MockMultipartFile("files", "b.txt", "text/plain", "bb".getBytes(StandardCharsets.UTF_8)))
                        .param("path", "/docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.files[0].name").value("a.txt"))
                .andExpect(jsonPath("$.files[0].size").value(5))
                .andExpect(jsonPath("$.files[1].path").value("/docs/b.txt"));

        assertThat(root.resolve("docs/a.txt")).hasContent("alpha");
        assertThat(root.resolve("docs/b.txt")).hasContent("bb");
    }

    @Test
    void multipartUpload_outsideRoot_isForbidden() throws Exception {
        mockMvc.perform(multipart("/api/upload")
                        .file(new MockMultipartFile("files", "a.txt", "text/plain", new byte[]{1}))
                        .param("path", "../../etc"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("ACCESS_DENIED"));
    }

    @Test
    void chunkedUpload_fullFlow() throws Exception {
        String uploadId = init("{\"path\":\"/\",\"filename\":\"hello.txt\",\"totalSize\":10,\"chunkSize\":4,\"totalChunks\":3}");

        postChunk(uploadId, 2, "ld");
        mockMvc.perform(multipart("/api/upload/chunk")
                        .file(new MockMultipartFile("chunk", "blob", "application/octet-stream",
                                "hell".getBytes(StandardCharsets.UTF_8)))
                        .param("uploadId", uploadId)
                        .param("chunkIndex", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunkIndex").value(0))
                .andExpect(jsonPath("$.received").value(true));
        postChunk(uploadId, 1, "owor");

        mockMvc.perform(post("/api/upload/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uploadId\":\"" + uploadId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.name").value("hello.txt"))
                .andExpect(jsonPath("$.size").value(10))
                .andExpect(jsonPath("$.path").value("/hello.txt"));

        assertThat(root.resolve("hello.txt")).hasContent("helloworld");
    }

    @Test
    void complete_withMissingChunks_returnsConflictWithIndices() throws Exception {
        String uploadId = init("{\"filename\":\"gap.bin\",\"totalSize\":3,\"chunkSize\":1,\"totalChunks\":3}");
        postChunk(uploadId, 1, "b");

        mockMvc.perform(post("/api/upload/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uploadId\":\"" + uploadId + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MISSING_CHUNKS"))
                .andExpect(jsonPath("$.missing", contains(0, 2)));
    }

    @Test
    void errors_mapToStatusCodes() throws Exception {
        String uploadId = init("{\"filename\":\"x.bin\",\"totalSize\":1,\"chunkSize\":1,\"totalChunks\":1}");

        mockMvc.perform(post("/api/upload/chunk")
                        .param("uploadId", uploadId)
                        .param("chunkIndex", "5")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{1}))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INDEX"));

        mockMvc.perform(post("/api/upload/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uploadId\":\"does-not-exist\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));

        mockMvc.perform(post("/api/upload/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"..\",\"filename\":\"a\",\"totalSize\":1,\"chunkSize\":1,\"totalChunks\":1}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/upload/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalSize\":1,\"chunkSize\":1,\"totalChunks\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PROTOCOL_ERROR"));

        mockMvc.perform(post("/api/upload/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{broken"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PROTOCOL_ERROR"));
    }

    @Test
    void init_withMissingNumericFields_isRejected() throws Exception {
        Files.createDirectories(root);
        Files.writeString(root.resolve("x.bin"), "keep");

        for (String body : new String[]{
                "{\"filename\":\"x.bin\",\"chunkSize\":5}",
                "{\"filename\":\"x.bin\",\"totalSize\":0,\"chunkSize\":5}",
                "{\"filename\":\"x.bin\",\"totalSize\":0,\"totalChunks\":0}"}) {
            mockMvc.perform(post("/api/upload/init")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.code").value("PROTOCOL_ERROR"));
        }

        assertThat(root.resolve("x.bin")).hasContent("keep");
        assertThat(tmp.resolve("scratch")).satisfiesAnyOf(
                dir -> assertThat(dir).doesNotExist(),
                dir -> assertThat(dir).isEmptyDirectory());
    }

    @Test
    void abort_isIdempotent() throws Exception {
        String uploadId = init("{\"filename\":\"y.bin\",\"totalSize\":1,\"chunkSize\":1,\"totalChunks\":1}");

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/upload/abort")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"uploadId\":\"" + uploadId + "\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true));
        }

        mockMvc.perform(post("/api/upload/chunk")
                        .param("uploadId", uploadId)
                        .param("chunkIndex", "0")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{1}))
                .andExpect(status().isNotFound());
    }

    private String init(String body) throws Exception {
        String response = mockMvc.perform(post("/api/upload/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(response, "$.uploadId");
    }

    private void postChunk(String uploadId, int index, String content) throws Exception {
        mockMvc.perform(post("/api/upload/chunk")
                        .param("uploadId", uploadId)
                        .param("chunkIndex", String.valueOf(index))
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(content.getBytes(StandardCharsets.UTF_8)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
