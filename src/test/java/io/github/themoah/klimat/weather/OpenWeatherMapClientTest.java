package io.github.themoah.klimat.weather;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.klimat.error.ExternalLookupException;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for OpenWeatherMapClient against a local stub of the weather API.
 */
@ExtendWith(VertxExtension.class)
public class OpenWeatherMapClientTest {

  private static final String VALID_KEY = "test-key";

  private int port;

  @BeforeEach
  void startStub(Vertx vertx, VertxTestContext ctx) {
    vertx.createHttpServer()
      .requestHandler(this::handle)
      .listen(0)
      .onComplete(ctx.succeeding(server -> {
        port = server.actualPort();
        ctx.completeNow();
      }));
  }

  private void handle(HttpServerRequest request) {
    if (!request.path().equals("/data/2.5/weather") || !"metric".equals(request.getParam("units"))) {
      request.response().setStatusCode(400).end();
      return;
    }
    if (!VALID_KEY.equals(request.getParam("appid")) && !"override-key".equals(request.getParam("appid"))) {
      request.response().setStatusCode(401)
        .end(new JsonObject().put("cod", 401).put("message", "Invalid API key").encode());
      return;
    }
    switch (request.getParam("q")) {
      case "London" -> request.response().setStatusCode(200).end(new JsonObject()
        .put("name", "London")
        .put("main", new JsonObject().put("temp", 14.25))
        .put("wind", new JsonObject().put("speed", 4.1))
        .put("weather", new JsonArray().add(new JsonObject().put("description", "light rain")))
        .encode());
      case "Cairo" -> request.response().setStatusCode(200)
        .end(new JsonObject().put("name", "Cairo").put("main", new JsonObject().put("temp", 38)).encode());
      case "Broken" -> request.response().setStatusCode(200).end("<html>oops</html>");
      case "Empty" -> request.response().setStatusCode(200).end("{}");
      default -> request.response().setStatusCode(404)
        .end(new JsonObject().put("cod", "404").put("message", "city not found").encode());
    }
  }

  private OpenWeatherMapClient client(Vertx vertx, String apiKey) {
    return new OpenWeatherMapClient(vertx, new WeatherConfig(apiKey, "http://localhost:" + port, 2_000L));
  }

  @Test
  void currentWeather_parsesResponse(Vertx vertx, VertxTestContext ctx) throws Exception {
    client(vertx, VALID_KEY).currentWeather("London").onComplete(ctx.succeeding(weather -> ctx.verify(() -> {
      assertEquals("London", weather.city());
      assertEquals(14.25, weather.temperature());
      assertEquals(4.1, weather.windSpeed());
      assertEquals("light rain", weather.description());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_optionalFieldsMissing(Vertx vertx, VertxTestContext ctx) throws Exception {
    client(vertx, VALID_KEY).currentWeather("Cairo").onComplete(ctx.succeeding(weather -> ctx.verify(() -> {
      assertEquals(38.0, weather.temperature());
      assertTrue(Double.isNaN(weather.windSpeed()));
      assertEquals("", weather.description());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_invalidKey_unauthorized(Vertx vertx, VertxTestContext ctx) throws Exception {
    client(vertx, "wrong-key").currentWeather("London").onComplete(ctx.failing(err -> ctx.verify(() -> {
      ExternalLookupException e = assertInstanceOf(ExternalLookupException.class, err);
      assertTrue(e.isUnauthorized());
      assertEquals("Error 401: Invalid API key", e.getMessage());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_perRequestKeyOverridesConfigured(Vertx vertx, VertxTestContext ctx) throws Exception {
    client(vertx, "wrong-key").currentWeather("London", "override-key")
      .onComplete(ctx.succeeding(weather -> ctx.verify(() -> {
        assertEquals("London", weather.city());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_missingKey_unauthorizedWithoutRequest(Vertx vertx, VertxTestContext ctx) throws Exception {
    client(vertx, null).currentWeather("London").onComplete(ctx.failing(err -> ctx.verify(() -> {
      ExternalLookupException e = assertInstanceOf(ExternalLookupException.class, err);
      assertEquals(ExternalLookupException.Reason.UNAUTHORIZED, e.reason());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_unknownCity_failed(Vertx vertx, VertxTestContext ctx) throws Exception {
    client(vertx, VALID_KEY).currentWeather("Atlantis").onComplete(ctx.failing(err -> ctx.verify(() -> {
      ExternalLookupException e = assertInstanceOf(ExternalLookupException.class, err);
      assertEquals(ExternalLookupException.Reason.FAILED, e.reason());
      assertTrue(e.getMessage().contains("city not found"));
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_malformedBody_failed(Vertx vertx, VertxTestContext ctx) throws Exception {
    OpenWeatherMapClient client = client(vertx, VALID_KEY);

    client.currentWeather("Broken")
      .recover(err -> {
        ExternalLookupException e = assertInstanceOf(ExternalLookupException.class, err);
        assertEquals(ExternalLookupException.Reason.FAILED, e.reason());
        return client.currentWeather("Empty");
      })
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        ExternalLookupException e = assertInstanceOf(ExternalLookupException.class, err);
        assertEquals(ExternalLookupException.Reason.FAILED, e.reason());
        assertTrue(e.getMessage().startsWith("Malformed weather response"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void currentWeather_connectionRefused_failed(Vertx vertx, VertxTestContext ctx) throws Exception {
    OpenWeatherMapClient client = new OpenWeatherMapClient(vertx, new WeatherConfig(VALID_KEY, "http://localhost:1", 2_000L));

    client.currentWeather("London").onComplete(ctx.failing(err -> ctx.verify(() -> {
      ExternalLookupException e = assertInstanceOf(ExternalLookupException.class, err);
      assertEquals(ExternalLookupException.Reason.FAILED, e.reason());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }
}
