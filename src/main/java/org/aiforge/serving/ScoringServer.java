package org.aiforge.serving;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.aiforge.utils.FileUtils;
import org.aiforge.utils.SerializationUtils;
import org.aiforge.utils.SystemEnvironment;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A RESTful webserver for a {@link ModelGateway} that runs on the local host */
public class ScoringServer {
  public static final String VERSION = "0.1.0";
  public static final String API_KEY_HEADER = "X-API-Key";
  private static final String REQUEST_CONTENT_TYPE_JSON = "application/json";

  private static final Logger logger = LoggerFactory.getLogger(ScoringServer.class);
  private final Server server;
  private final ServerConnector httpConnector;

  /**
   * Constructs a {@link ScoringServer} to serve the specified {@link ModelGateway} on the local
   * host. Thread pool bounds and the API key are taken from the configuration
   */
  public ScoringServer(ModelGateway gateway, GatewayConfig config) {
    this.server =
        new Server(
            new QueuedThreadPool(config.getServerMaxThreads(), config.getServerMinThreads()));
    this.server.setStopAtShutdown(true);

    this.httpConnector = new ServerConnector(this.server, new HttpConnectionFactory());
    this.server.addConnector(this.httpConnector);

    String apiKey = config.getApiKey().orElse(null);
    ServletContextHandler rootContextHandler = new ServletContextHandler(null, "/");
    rootContextHandler.addServlet(new ServletHolder(new PingServlet()), "/ping");
    rootContextHandler.addServlet(new ServletHolder(new VersionServlet()), "/version");
    rootContextHandler.addServlet(new ServletHolder(new HealthServlet(gateway)), "/health");
    rootContextHandler.addServlet(new ServletHolder(new InfoServlet(gateway, apiKey)), "/info");
    rootContextHandler.addServlet(new ServletHolder(new DebugServlet(gateway, apiKey)), "/debug");
    rootContextHandler.addServlet(
        new ServletHolder(new PredictServlet(gateway, apiKey)), "/predict");
    rootContextHandler.addServlet(
        new ServletHolder(new PredictServlet(gateway, apiKey)), "/invocations");
    this.server.setHandler(rootContextHandler);
  }

  /**
   * Starts the scoring server locally on a randomly-selected, available port
   *
   * @throws IllegalStateException If the server is already active on another port
   * @throws ServerStateChangeException If the server failed to start and was inactive prior to the
   *     invocation of this method
   */
  public void start() {
    // Setting port zero instructs Jetty to select a random port
    start(0);
  }

  /**
   * Starts the scoring server locally on the specified port
   *
   * @throws IllegalStateException If the server is already active on another port
   * @throws ServerStateChangeException If the server failed to start and was inactive prior to the
   *     invocation of this method
   */
  public void start(int portNumber) {
    if (isActive()) {
      int activePort = this.httpConnector.getLocalPort();
      throw new IllegalStateException(
          String.format(
              "Attempted to start a server that is already active on port %d", activePort));
    }

    this.httpConnector.setPort(portNumber);
    try {
      this.server.start();
    } catch (Exception e) {
      throw new ServerStateChangeException(e);
    }
    logger.info(String.format("Started scoring server on port: %d", getPort().orElse(-1)));
  }

  /**
   * Stops the scoring server
   *
   * @throws ServerStateChangeException If the server failed to stop
   */
  public void stop() {
    try {
      this.server.stop();
      this.server.join();
    } catch (Exception e) {
      throw new ServerStateChangeException(e);
    }
    logger.info("Stopped the scoring server successfully.");
  }

  /** @return `true` if the server is active (running), `false` otherwise */
  public boolean isActive() {
    return this.server.isStarted();
  }

  /**
   * @return Optional that either: - Contains the port on which the server is running, if the server
   *     is active - Is empty, if the server is not active
   */
  public Optional<Integer> getPort() {
    int boundPort = this.httpConnector.getLocalPort();
    if (boundPort >= 0) {
      return Optional.of(boundPort);
    } else {
      // The server connector port request returned an error code
      return Optional.empty();
    }
  }

  public static class ServerStateChangeException extends RuntimeException {
    ServerStateChangeException(Exception e) {
      super(e);
    }
  }

  static Map<String, Object> errorBody(String error, String detail, int code) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("detail", detail);
    body.put("code", code);
    return body;
  }

  static void writeJson(HttpServletResponse response, int status, Object body)
      throws IOException {
    String content;
    try {
      content = SerializationUtils.toJson(body);
    } catch (JsonProcessingException e) {
      logger.error("Failed to serialize the response body.", e);
      status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
      content =
          SerializationUtils.toJson(
              errorBody(
                  "Serialization failed",
                  "The response could not be serialized as JSON",
                  HttpServletResponse.SC_INTERNAL_SERVER_ERROR));
    }
    response.setStatus(status);
    response.setContentType(REQUEST_CONTENT_TYPE_JSON);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.getWriter().print(content);
    response.getWriter().close();
  }

  static class PingServlet extends HttpServlet {
    @Override
    public void doGet(HttpServletRequest request, HttpServletResponse response) {
      response.setStatus(HttpServletResponse.SC_OK);
    }
  }

  static class VersionServlet extends HttpServlet {
    @Override
    public void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
      response.setStatus(HttpServletResponse.SC_OK);
      response.getWriter().print(VERSION);
      response.getWriter().close();
    }
  }

  static class HealthServlet extends HttpServlet {
    private final ModelGateway gateway;

    HealthServlet(ModelGateway gateway) {
      this.gateway = gateway;
    }

    @Override
    public void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
      ModelStatus status = gateway.status();
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", status.isLoaded() ? "healthy" : "initializing");
      body.put("model_loaded", status.isLoaded());
      body.put("model_id", status.getModelIdentifier().orElse(null));
      body.put("framework", status.getFramework().map(Object::toString).orElse(null));
      writeJson(response, HttpServletResponse.SC_OK, body);
    }
  }

  /** Base class of servlets that require the `X-API-Key` header when an API key is configured */
  abstract static class AuthenticatedServlet extends HttpServlet {
    protected final ModelGateway gateway;
    private final String apiKey;

    AuthenticatedServlet(ModelGateway gateway, String apiKey) {
      this.gateway = gateway;
      this.apiKey = apiKey;
    }

    /**
     * @return `true` if the request may proceed. Otherwise, an error response has been written
     */
    protected boolean authorize(HttpServletRequest request, HttpServletResponse response)
        throws IOException {
      if (apiKey == null) {
        return true;
      }
      String presented = request.getHeader(API_KEY_HEADER);
      if (presented == null || presented.isEmpty()) {
        writeJson(
            response,
            HttpServletResponse.SC_UNAUTHORIZED,
            errorBody(
                "Missing API key",
                String.format("Provide the `%s` header", API_KEY_HEADER),
                HttpServletResponse.SC_UNAUTHORIZED));
        return false;
      }
      if (!MessageDigest.isEqual(
          presented.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8))) {
        logger.info("Rejected a request with an invalid API key");
        writeJson(
            response,
            HttpServletResponse.SC_FORBIDDEN,
            errorBody("Invalid API key", "The API key is not valid",
                HttpServletResponse.SC_FORBIDDEN));
        return false;
      }
      return true;
    }
  }

  static class InfoServlet extends AuthenticatedServlet {
    InfoServlet(ModelGateway gateway, String apiKey) {
      super(gateway, apiKey);
    }

    @Override
    public void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
      if (!authorize(request, response)) {
        return;
      }
      Optional<LoadedModel> loaded = gateway.getSession().getLoadedModel();
      if (!loaded.isPresent()) {
        writeJson(
            response,
            HttpServletResponse.SC_SERVICE_UNAVAILABLE,
            errorBody("Model not loaded", "No model is currently loaded",
                HttpServletResponse.SC_SERVICE_UNAVAILABLE));
        return;
      }
      LoadedModel model = loaded.get();
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("model_id", model.getModelIdentifier());
      body.put("model_path", model.getModelPath().toString());
      body.put("framework", model.getFramework().getValue());
      body.put("load_strategy", model.getStrategy().getValue());
      body.put("manifest", model.getManifest().map(manifest -> manifest.toJsonNode()).orElse(null));
      body.put("status", "ready");
      writeJson(response, HttpServletResponse.SC_OK, body);
    }
  }

  static class DebugServlet extends AuthenticatedServlet {
    DebugServlet(ModelGateway gateway, String apiKey) {
      super(gateway, apiKey);
    }

    @Override
    public void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
      if (!authorize(request, response)) {
        return;
      }
      writeJson(response, HttpServletResponse.SC_OK, gateway.debugInfo());
    }
  }

  static class PredictServlet extends AuthenticatedServlet {
    PredictServlet(ModelGateway gateway, String apiKey) {
      super(gateway, apiKey);
    }

    @Override
    public void doPost(HttpServletRequest request, HttpServletResponse response)
        throws IOException {
      if (!authorize(request, response)) {
        return;
      }
      String requestContentType = request.getHeader("Content-type");
      if (requestContentType == null
          || !requestContentType.toLowerCase(Locale.ROOT).startsWith(REQUEST_CONTENT_TYPE_JSON)) {
        logger.info(
            String.format(
                "Received a request with an unsupported content type: %s", requestContentType));
        writeJson(
            response,
            HttpServletResponse.SC_BAD_REQUEST,
            errorBody(
                "Unsupported content type",
                "Requests must have a content header of type `application/json`",
                HttpServletResponse.SC_BAD_REQUEST));
        return;
      }
      String requestBody = FileUtils.readInputStreamAsUtf8(request.getInputStream());
      Object input;
      try {
        input = parseInput(requestBody);
      } catch (InvalidRequestException e) {
        writeJson(
            response,
            HttpServletResponse.SC_BAD_REQUEST,
            errorBody("Invalid request", e.getMessage(), HttpServletResponse.SC_BAD_REQUEST));
        return;
      }

      try {
        PredictionResult result = gateway.predict(input);
        writeJson(response, HttpServletResponse.SC_OK, toResponseBody(result));
      } catch (ModelNotReadyException e) {
        writeJson(
            response,
            HttpServletResponse.SC_SERVICE_UNAVAILABLE,
            errorBody("Model not loaded", e.getMessage(),
                HttpServletResponse.SC_SERVICE_UNAVAILABLE));
      } catch (PredictorEvaluationException e) {
        logger.error("Encountered a failure when evaluating the model.", e);
        writeJson(
            response,
            HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
            errorBody("Prediction failed", e.getMessage(),
                HttpServletResponse.SC_INTERNAL_SERVER_ERROR));
      } catch (Exception e) {
        logger.error("An unknown error occurred while evaluating the prediction request.", e);
        writeJson(
            response,
            HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
            errorBody(
                "Prediction failed",
                "An unknown error occurred while evaluating the model!",
                HttpServletResponse.SC_INTERNAL_SERVER_ERROR));
      }
    }

    private static Object parseInput(String requestBody) throws InvalidRequestException {
      JsonNode body;
      try {
        body = SerializationUtils.readTree(requestBody);
      } catch (JsonProcessingException e) {
        throw new InvalidRequestException(
            String.format("The request body is not valid JSON: %s", e.getOriginalMessage()));
      }
      if (body == null || !body.isObject() || !body.has("input")) {
        throw new InvalidRequestException(
            "The request body must be a JSON object with an `input` field");
      }
      try {
        return SerializationUtils.treeToValue(body.get("input"));
      } catch (JsonProcessingException e) {
        throw new InvalidRequestException(
            String.format("The `input` field could not be read: %s", e.getOriginalMessage()));
      }
    }

    private static Map<String, Object> toResponseBody(PredictionResult result) {
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("inference_time_ms", result.getInferenceTimeMillis());
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("prediction", result.getPrediction());
      body.put("model_id", result.getModelIdentifier());
      body.put("framework", result.getFramework().getValue());
      body.put("metadata", metadata);
      return body;
    }

    static class InvalidRequestException extends Exception {
      InvalidRequestException(String message) {
        super(message);
      }
    }
  }

  /**
   * Entrypoint for serving a model with the {@link ScoringServer}
   *
   * <p>This entrypoint accepts the following optional arguments: 1. The path to the model file or
   * directory to serve. Defaults to `AIFORGE_MODEL_PATH`, then to a search of the model
   * directory. 2. The number of the port on which to serve the model. Defaults to `AIFORGE_PORT`.
   */
  public static void main(String[] args) {
    GatewayConfig config = GatewayConfig.fromEnvironment(SystemEnvironment.get());
    Optional<Path> modelPath = Optional.empty();
    if (args.length > 0) {
      modelPath = Optional.of(Paths.get(args[0]));
    }
    int portNumber = config.getPort();
    if (args.length > 1) {
      portNumber = Integer.parseInt(args[1]);
    }
    logger.info("Starting the model gateway...");
    ModelGateway gateway = ModelGateway.create(config);
    gateway.loadOnStartup(modelPath, Optional.empty());
    ScoringServer server = new ScoringServer(gateway, config);
    try {
      server.start(portNumber);
    } catch (ServerStateChangeException e) {
      logger.error("Encountered an error while starting the prediction server.", e);
    }
  }
}
