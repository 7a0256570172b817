package org.aiforge.serving;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.servlet.http.HttpServletResponse;
import org.aiforge.sklearn.Estimators;
import org.aiforge.sklearn.RowSumEstimator;
import org.aiforge.utils.MapEnvironment;
import org.aiforge.utils.SerializationUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.HttpClientBuilder;
import org.junit.After;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ScoringServerTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private static final HttpClient httpClient = HttpClientBuilder.create().build();

  private ScoringServer server;

  private static Map<?, ?> parseJsonObject(String json) throws IOException {
    return (Map<?, ?>) SerializationUtils.treeToValue(SerializationUtils.readTree(json));
  }

  private static String getHttpResponseBody(HttpResponse response) throws IOException {
    HttpEntity entity = response.getEntity();
    if (entity == null) {
      return "";
    }
    InputStream responseContentStream = entity.getContent();
    String body =
        new BufferedReader(new InputStreamReader(responseContentStream, StandardCharsets.UTF_8))
            .lines()
            .collect(Collectors.joining(System.lineSeparator()));
    return body;
  }

  @After
  public void stopServer() {
    if (server != null && server.isActive()) {
      server.stop();
    }
  }

  private MapEnvironment environment() {
    return new MapEnvironment()
        .with(
            GatewayConfig.ENV_VAR_MODEL_DIR,
            temporaryFolder.getRoot().toPath().resolve("no_model_dir").toString());
  }

  private String startServer(MapEnvironment environment, boolean loadModel) throws Exception {
    GatewayConfig config = GatewayConfig.fromEnvironment(environment);
    ModelGateway gateway = ModelGateway.create(config);
    if (loadModel) {
      Path directory = temporaryFolder.newFolder("iris").toPath();
      Estimators.write(new RowSumEstimator(), directory.resolve("model.pkl"));
      gateway.load(
          LoadRequest.builder().setModelPath(directory).setModelIdentifier("acme/iris").build());
    }
    server = new ScoringServer(gateway, config);
    server.start();
    return String.format("http://localhost:%d", server.getPort().get());
  }

  private static HttpPost jsonPost(String url, String body) throws Exception {
    HttpPost postRequest = new HttpPost(url);
    postRequest.addHeader("Content-type", "application/json");
    postRequest.setEntity(new StringEntity(body));
    return postRequest;
  }

  @Test
  public void testScoringServerRespondsToPingsCorrectly() throws Exception {
    String baseUrl = startServer(environment(), false);
    HttpResponse response = httpClient.execute(new HttpGet(baseUrl + "/ping"));
    getHttpResponseBody(response);
    Assert.assertEquals(HttpServletResponse.SC_OK, response.getStatusLine().getStatusCode());
  }

  @Test
  public void testVersionIsReported() throws Exception {
    String baseUrl = startServer(environment(), false);
    HttpResponse response = httpClient.execute(new HttpGet(baseUrl + "/version"));
    Assert.assertEquals(ScoringServer.VERSION, getHttpResponseBody(response));
  }

  @Test
  public void testHealthReportsInitializingWithoutAModel() throws Exception {
    String baseUrl = startServer(environment(), false);
    HttpResponse response = httpClient.execute(new HttpGet(baseUrl + "/health"));
    Map<?, ?> body = parseJsonObject(getHttpResponseBody(response));

    Assert.assertEquals(HttpServletResponse.SC_OK, response.getStatusLine().getStatusCode());
    Assert.assertEquals("initializing", body.get("status"));
    Assert.assertEquals(false, body.get("model_loaded"));
  }

  @Test
  public void testHealthReportsTheLoadedModel() throws Exception {
    String baseUrl = startServer(environment(), true);
    HttpResponse response = httpClient.execute(new HttpGet(baseUrl + "/health"));
    Map<?, ?> body = parseJsonObject(getHttpResponseBody(response));

    Assert.assertEquals("healthy", body.get("status"));
    Assert.assertEquals(true, body.get("model_loaded"));
    Assert.assertEquals("acme/iris", body.get("model_id"));
    Assert.assertEquals("sklearn", body.get("framework"));
  }

  @Test
  public void testPredictionsAreServedOnBothRoutes() throws Exception {
    String baseUrl = startServer(environment(), true);
    for (String route : Arrays.asList("/predict", "/invocations")) {
      HttpResponse response =
          httpClient.execute(jsonPost(baseUrl + route, "{\"input\": [[1, 2], [3.5, 4]]}"));
      String responseBody = getHttpResponseBody(response);
      Assert.assertEquals(HttpServletResponse.SC_OK, response.getStatusLine().getStatusCode());

      Map<?, ?> body = parseJsonObject(responseBody);
      Assert.assertEquals(Arrays.asList(3.0, 7.5), body.get("prediction"));
      Assert.assertEquals("acme/iris", body.get("model_id"));
      Assert.assertEquals("sklearn", body.get("framework"));
      Map<?, ?> metadata = (Map<?, ?>) body.get("metadata");
      Assert.assertTrue(metadata.containsKey("inference_time_ms"));
    }
  }

  @Test
  public void testScoringServerRespondsToBadContentTypeWithBadRequestCode() throws Exception {
    String baseUrl = startServer(environment(), true);
    HttpPost postRequest = new HttpPost(baseUrl + "/invocations");
    postRequest.addHeader("Content-type", "not-a-content-type");
    postRequest.setEntity(new StringEntity("body"));

    HttpResponse response = httpClient.execute(postRequest);
    getHttpResponseBody(response);
    Assert.assertEquals(
        HttpServletResponse.SC_BAD_REQUEST, response.getStatusLine().getStatusCode());
  }

  @Test
  public void testMalformedOrIncompleteBodiesAreBadRequests() throws Exception {
    String baseUrl = startServer(environment(), true);
    for (String body : Arrays.asList("{\"input\": [1, 2", "{\"inputs\": [1, 2]}", "[1, 2]")) {
      HttpResponse response = httpClient.execute(jsonPost(baseUrl + "/predict", body));
      Map<?, ?> error = parseJsonObject(getHttpResponseBody(response));
      Assert.assertEquals(
          HttpServletResponse.SC_BAD_REQUEST, response.getStatusLine().getStatusCode());
      Assert.assertEquals(HttpServletResponse.SC_BAD_REQUEST, error.get("code"));
    }
  }

  @Test
  public void testPredictionWithoutAModelIsServiceUnavailable() throws Exception {
    String baseUrl = startServer(environment(), false);
    HttpResponse response = httpClient.execute(jsonPost(baseUrl + "/predict", "{\"input\": 1}"));
    Map<?, ?> error = parseJsonObject(getHttpResponseBody(response));
    Assert.assertEquals(
        HttpServletResponse.SC_SERVICE_UNAVAILABLE, response.getStatusLine().getStatusCode());
    Assert.assertEquals("Model not loaded", error.get("error"));
  }

  @Test
  public void testFailingPredictionIsAnInternalServerError() throws Exception {
    String baseUrl = startServer(environment(), true);
    HttpResponse response =
        httpClient.execute(jsonPost(baseUrl + "/predict", "{\"input\": [[1, \"two\"]]}"));
    Map<?, ?> error = parseJsonObject(getHttpResponseBody(response));
    Assert.assertEquals(
        HttpServletResponse.SC_INTERNAL_SERVER_ERROR, response.getStatusLine().getStatusCode());
    Assert.assertEquals("Prediction failed", error.get("error"));
  }

  @Test
  public void testApiKeyIsRequiredWhenConfigured() throws Exception {
    String baseUrl = startServer(environment().with(GatewayConfig.ENV_VAR_API_KEY, "s3cret"), true);

    HttpResponse missing = httpClient.execute(jsonPost(baseUrl + "/predict", "{\"input\": [1]}"));
    getHttpResponseBody(missing);
    Assert.assertEquals(
        HttpServletResponse.SC_UNAUTHORIZED, missing.getStatusLine().getStatusCode());

    HttpPost wrongKey = jsonPost(baseUrl + "/predict", "{\"input\": [1]}");
    wrongKey.addHeader(ScoringServer.API_KEY_HEADER, "guess");
    HttpResponse wrong = httpClient.execute(wrongKey);
    getHttpResponseBody(wrong);
    Assert.assertEquals(HttpServletResponse.SC_FORBIDDEN, wrong.getStatusLine().getStatusCode());

    HttpPost rightKey = jsonPost(baseUrl + "/predict", "{\"input\": [1]}");
    rightKey.addHeader(ScoringServer.API_KEY_HEADER, "s3cret");
    HttpResponse right = httpClient.execute(rightKey);
    getHttpResponseBody(right);
    Assert.assertEquals(HttpServletResponse.SC_OK, right.getStatusLine().getStatusCode());

    HttpResponse health = httpClient.execute(new HttpGet(baseUrl + "/health"));
    getHttpResponseBody(health);
    Assert.assertEquals(HttpServletResponse.SC_OK, health.getStatusLine().getStatusCode());
  }

  @Test
  public void testInfoDescribesTheLoadedModel() throws Exception {
    String baseUrl = startServer(environment(), true);
    HttpResponse response = httpClient.execute(new HttpGet(baseUrl + "/info"));
    Map<?, ?> body = parseJsonObject(getHttpResponseBody(response));
    Assert.assertEquals("ready", body.get("status"));
    Assert.assertEquals("framework", body.get("load_strategy"));
    Assert.assertNull(body.get("manifest"));
  }

  @Test
  public void testInfoWithoutAModelIsServiceUnavailable() throws Exception {
    String baseUrl = startServer(environment(), false);
    HttpResponse response = httpClient.execute(new HttpGet(baseUrl + "/info"));
    getHttpResponseBody(response);
    Assert.assertEquals(
        HttpServletResponse.SC_SERVICE_UNAVAILABLE, response.getStatusLine().getStatusCode());
  }

  @Test
  public void testDebugReportsTheLastLoadFailure() throws Exception {
    GatewayConfig config = GatewayConfig.fromEnvironment(environment());
    ModelGateway gateway = ModelGateway.create(config);
    gateway.loadOnStartup(java.util.Optional.empty(), java.util.Optional.empty());
    server = new ScoringServer(gateway, config);
    server.start();

    String url = String.format("http://localhost:%d/debug", server.getPort().get());
    HttpResponse response = httpClient.execute(new HttpGet(url));
    Map<?, ?> body = parseJsonObject(getHttpResponseBody(response));

    Assert.assertEquals(false, body.get("model_loaded"));
    Map<?, ?> failure = (Map<?, ?>) body.get("last_failure");
    Assert.assertEquals("NoLoadStrategySucceededException", failure.get("error_type"));
    List<?> trace = (List<?>) failure.get("resolution_trace");
    Assert.assertFalse(trace.isEmpty());
  }

  @Test
  public void testMultipleServersRunOnDifferentPortsSuccessfully() throws Exception {
    GatewayConfig config = GatewayConfig.fromEnvironment(environment());
    ModelGateway gateway = ModelGateway.create(config);
    ScoringServer first = new ScoringServer(gateway, config);
    ScoringServer second = new ScoringServer(gateway, config);
    first.start();
    second.start();
    try {
      Assert.assertNotEquals(first.getPort().get(), second.getPort().get());
      Assert.assertTrue(first.isActive());
      Assert.assertTrue(second.isActive());
    } finally {
      first.stop();
      second.stop();
    }
    Assert.assertFalse(first.isActive());
  }

  @Test
  public void testStartingAnActiveServerThrowsIllegalStateException() throws Exception {
    startServer(environment(), false);
    try {
      server.start();
      Assert.fail("Expected starting an active server to throw");
    } catch (IllegalStateException e) {
      // Success
    }
  }
}
