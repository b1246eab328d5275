package ols;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import ols.ml.Dataset;
import ols.ml.Estimation;
import ols.ml.LuMatrixInverter;
import ols.ml.MatrixInverter;
import ols.ml.OlsEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * HTTP access to the OLS estimator. Returns the raw result bundle; diagnostics are left to the client.
 * Run with: mvn exec:java -Dexec.mainClass="ols.WebApp"
 */
public class WebApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebApp.class);

    // NaN/Infinity are legal in results
    static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    /** Body of POST /api/estimate. */
    static class EstimateRequest {
        double[][] x;
        double[] y;
        Boolean constant;
    }

    /** Status code plus JSON-ready body. */
    static final class Reply {
        final int status;
        final Object body;

        Reply(int status, Object body) {
            this.status = status;
            this.body = body;
        }
    }

    public static void main(String[] args) {
        int port = OlsConfig.port();
        MatrixInverter inverter = new LuMatrixInverter(
            OlsConfig.singularityThreshold(LuMatrixInverter.DEFAULT_SINGULARITY_THRESHOLD));
        create(inverter, port).start("0.0.0.0", port);
        LOG.info("OLS web app: http://localhost:{}", port);
    }

    static Javalin create(MatrixInverter inverter, int port) {
        Javalin app = Javalin.create();

        app.post("/api/estimate", ctx -> send(ctx, estimate(ctx.body(), inverter)));

        app.get("/api/sample", ctx -> send(ctx, sample()));
        app.get("/api/health", ctx -> send(ctx, health(port)));
        return app;
    }

    static Reply sample() {
        Dataset sample = Dataset.sample();
        Map<String, Object> out = new HashMap<>();
        out.put("x", sample.getX());
        out.put("y", sample.getY());
        return new Reply(200, out);
    }

    static Reply health(int port) {
        Map<String, Object> h = new HashMap<>();
        h.put("status", "ok");
        h.put("port", port);
        return new Reply(200, h);
    }

    static Reply estimate(String body, MatrixInverter inverter) {
        Map<String, Object> out = new HashMap<>();
        if (body == null || body.isBlank()) {
            out.put("error", "Missing request body");
            return new Reply(400, out);
        }
        EstimateRequest req;
        try {
            req = GSON.fromJson(body, EstimateRequest.class);
        } catch (JsonParseException e) {
            out.put("error", "Invalid JSON: " + e.getMessage());
            return new Reply(400, out);
        } catch (IllegalArgumentException e) {
            // null inside a number array
            out.put("error", "'x' and 'y' must contain numbers only");
            return new Reply(400, out);
        }
        if (req == null || req.x == null || req.y == null) {
            out.put("error", "Missing 'x' or 'y' array");
            return new Reply(400, out);
        }
        for (double[] row : req.x) {
            if (row == null) {
                out.put("error", "'x' rows must be arrays of numbers");
                return new Reply(400, out);
            }
        }
        boolean constant = req.constant == null || req.constant;

        Estimation estimation = Estimation.run(req.x, req.y, constant, inverter);
        if (!estimation.isSuccess()) {
            out.put("error", estimation.getMessage());
            out.put("kind", estimation.getFailureKind().name());
            return new Reply(422, out);
        }
        OlsEstimator ols = estimation.getEstimator();
        out.put("betas", ols.getBetas());
        out.put("xt", ols.getXt());
        out.put("xtx", ols.getXtx());
        out.put("xtxi", ols.getXtxi());
        out.put("predy", ols.getPredy());
        out.put("u", ols.getU());
        return new Reply(200, out);
    }

    private static void send(Context ctx, Reply reply) {
        ctx.status(reply.status).contentType("application/json").result(GSON.toJson(reply.body));
    }
}
