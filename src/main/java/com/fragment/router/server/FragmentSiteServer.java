package com.fragment.router.server;

import com.fragment.router.core.model.Site;
import com.fragment.router.fragment.Dataset;
import com.fragment.router.fragment.DatasetLoader;
import com.fragment.router.fragment.FragmentSite;
import com.fragment.router.partition.PartitionPolicy;
import com.fragment.router.partition.PartitionThresholds;
import com.fragment.router.rest.FragmentSiteApplication;
import com.sun.net.httpserver.HttpServer;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.jdkhttp.JdkHttpServerFactory;
import org.glassfish.jersey.server.ResourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Runs one fragment site on the JDK HTTP server.
 *
 * <p>The site is chosen by the first program argument or {@code fragment-site.id}
 * ({@code site-a} or {@code site-b}). Site-A listens on 3001 and Site-B on 3002
 * unless {@code fragment-site.port} is set.</p>
 */
public final class FragmentSiteServer {
    private static final Logger log = LoggerFactory.getLogger(FragmentSiteServer.class);

    private static final String SITE_ID = "fragment-site.id";
    private static final String PORT = "fragment-site.port";
    private static final String DATASET = "fragment-site.dataset";
    private static final String DEPARTMENT = "fragment-router.department";

    private FragmentSiteServer() {
    }

    /**
     * Starts a fragment site. Port 0 binds an ephemeral port.
     */
    public static HttpServer start(FragmentSite site, int port) {
        ResourceConfig resourceConfig = ResourceConfig.forApplication(new FragmentSiteApplication(site))
                .register(JacksonFeature.class);
        HttpServer server = JdkHttpServerFactory.createHttpServer(
                URI.create("http://localhost:" + port + "/"), resourceConfig);
        log.info("Fragment site {} running on port {}", site.getSite().getId(), server.getAddress().getPort());
        return server;
    }

    public static int defaultPort(Site site) {
        return site == Site.SITE_A ? 3001 : 3002;
    }

    public static void main(String[] args) {
        Config config = ConfigProvider.getConfig();
        String siteId = args.length > 0 ? args[0] : config.getOptionalValue(SITE_ID, String.class).orElse("site-a");
        Site site = Site.fromId(siteId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown fragment site: " + siteId));
        int port = config.getOptionalValue(PORT, Integer.class).orElse(defaultPort(site));
        String department = config.getOptionalValue(DEPARTMENT, String.class)
                .orElse(PartitionThresholds.DEFAULT_DEPARTMENT);
        String datasetLocation = config.getOptionalValue(DATASET, String.class).orElse("dataset");

        Dataset dataset = new DatasetLoader().load(datasetLocation);
        FragmentSite fragmentSite = FragmentSite.seeded(PartitionPolicy.forSite(site), department, dataset);

        HttpServer server = start(fragmentSite, port);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Stopping fragment site {}", site.getId());
            server.stop(0);
        }, "fragment-site-shutdown"));
    }
}
