package tech.yump.reconciler.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.reconciler.cluster.ClusterApi;
import tech.yump.reconciler.cluster.Fabric8ClusterApi;
import tech.yump.reconciler.env.RunEnvironment;
import tech.yump.reconciler.env.RunEnvironmentLoader;
import tech.yump.reconciler.env.ValueGenerator;
import tech.yump.reconciler.retry.Sleeper;

import java.io.PrintStream;
import java.time.Clock;

/**
 * Wires the collaborators that sit at the process boundary: the orchestrator client, the ambient
 * environment snapshot, time, and the report stream.
 */
@Configuration
@Slf4j
public class ReconcilerConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(KubernetesClient.class)
    public KubernetesClient kubernetesClient() {
        // Ambient credentials: kubeconfig, KUBECONFIG or the in-cluster service account
        return new KubernetesClientBuilder().build();
    }

    @Bean
    @ConditionalOnMissingBean(ClusterApi.class)
    public ClusterApi clusterApi(KubernetesClient kubernetesClient) {
        return new Fabric8ClusterApi(kubernetesClient);
    }

    /**
     * The only place the process environment is read.
     */
    @Bean
    @ConditionalOnMissingBean(RunEnvironment.class)
    public RunEnvironment runEnvironment(ReconcilerProperties properties) {
        RunEnvironment environment = RunEnvironmentLoader.load(System.getenv(), properties.overrideFiles());
        log.debug("Captured {}", environment);
        return environment;
    }

    @Bean
    public ValueGenerator valueGenerator() {
        return new ValueGenerator();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(PrintStream.class)
    public PrintStream reportStream() {
        return System.out;
    }
}
