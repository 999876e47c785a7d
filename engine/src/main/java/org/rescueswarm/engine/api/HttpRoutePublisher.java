package org.rescueswarm.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.rescueswarm.engine.api.dto.RoutesDto;
import org.rescueswarm.engine.domain.model.RouteSolution;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.POST;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based RoutePublisher posting route sets as JSON.
 */
public final class HttpRoutePublisher implements RoutePublisher {

    private static final Logger LOG = Logger.getLogger(HttpRoutePublisher.class.getName());

    private final RoutesApiService api;
    private final Clock clock;

    public HttpRoutePublisher(String baseUrl) {
        this(baseUrl, Clock.systemUTC());
    }

    public HttpRoutePublisher(String baseUrl, Clock clock) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(RoutesApiService.class);
    }

    @Override
    public boolean publish(List<RouteSolution> solutions) {
        RoutesDto body = RoutesDto.from(solutions, clock.instant().toString());
        return executeVoid(api.publishRoutes(body), "POST /v1/routes");
    }

    /**
     * Execute a Retrofit call that returns void.
     */
    private boolean executeVoid(Call<Void> call, String description) {
        try {
            Response<Void> response = call.execute();
            if (!response.isSuccessful()) {
                LOG.warning(() -> String.format("[API] %s failed: %d %s",
                        description, response.code(), response.message()));
                return false;
            }
            return true;
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            return false;
        }
    }

    /**
     * Retrofit service interface for the routes endpoint.
     */
    interface RoutesApiService {
        @POST("v1/routes")
        Call<Void> publishRoutes(@Body RoutesDto routes);
    }
}
