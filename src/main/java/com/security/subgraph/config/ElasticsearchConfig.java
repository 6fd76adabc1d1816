package com.security.subgraph.config;

import com.security.subgraph.constants.SubgraphConstants;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.elasticsearch.client.RestHighLevelClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch配置类
 * 仅在 subgraph.sink.type=elasticsearch 时创建客户端
 */
@Configuration
@ConditionalOnProperty(prefix = "subgraph.sink", name = "type",
        havingValue = SubgraphConstants.Sink.TYPE_ELASTICSEARCH)
public class ElasticsearchConfig {

    @Value("${elasticsearch.hosts:localhost:9200}")
    private String hosts;

    @Value("${elasticsearch.scheme:http}")
    private String scheme;

    @Value("${elasticsearch.username:}")
    private String username;

    @Value("${elasticsearch.password:}")
    private String password;

    @Value("${elasticsearch.connection-timeout:5000}")
    private int connectionTimeout;

    @Value("${elasticsearch.socket-timeout:60000}")
    private int socketTimeout;

    /**
     * 创建RestHighLevelClient Bean，容器关闭时释放连接
     */
    @Bean(destroyMethod = "close")
    public RestHighLevelClient restHighLevelClient() {
        RestClientBuilder builder = RestClient.builder(parseHosts(hosts, scheme));

        builder.setRequestConfigCallback(requestConfigBuilder ->
            requestConfigBuilder
                .setConnectTimeout(connectionTimeout)
                .setSocketTimeout(socketTimeout)
        );

        // 如果配置了用户名密码，添加认证
        if (!username.isEmpty() && !password.isEmpty()) {
            final CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(
                AuthScope.ANY,
                new UsernamePasswordCredentials(username, password)
            );

            builder.setHttpClientConfigCallback(httpClientBuilder ->
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider)
            );
        }

        return new RestHighLevelClient(builder);
    }

    /**
     * 解析 "host1:9200,host2:9201" 形式的地址列表，端口缺省为 9200
     */
    static HttpHost[] parseHosts(String hosts, String scheme) {
        String[] hostArray = hosts.split(",");
        HttpHost[] httpHosts = new HttpHost[hostArray.length];

        for (int i = 0; i < hostArray.length; i++) {
            String host = hostArray[i].trim();
            int colon = host.lastIndexOf(':');
            if (colon > 0) {
                httpHosts[i] = new HttpHost(host.substring(0, colon),
                        Integer.parseInt(host.substring(colon + 1)), scheme);
            } else {
                httpHosts[i] = new HttpHost(host, 9200, scheme);
            }
        }
        return httpHosts;
    }
}
