package xyz.firestige.pipeline.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 占位符角色解析
 *
 * <p>栈部署描述中的角色 ARN 带有 {@code ${AWS::Partition}}、{@code ${AWS::Region}}、
 * {@code ${AWS::AccountId}} 占位符。解析时：
 * <ul>
 *   <li>Region / AccountId 优先使用调用方给出的目标区域与账号，缺省时取流水线所在环境</li>
 *   <li>Partition 始终取流水线所在环境</li>
 * </ul>
 * 同一个占位符 ARN 只导入一次，之后的调用返回同一个角色对象。
 *
 * @since 1.0
 */
public class PlaceholderRoleResolver {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderRoleResolver.class);

    public static final String PARTITION = "${AWS::Partition}";
    public static final String REGION = "${AWS::Region}";
    public static final String ACCOUNT_ID = "${AWS::AccountId}";

    private final PipelineEnvironment environment;
    private final Map<String, ExecutionRole> imported = new LinkedHashMap<>();

    public PlaceholderRoleResolver(PipelineEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
    }

    /**
     * @param region  目标区域，null 表示流水线所在区域
     * @param account 目标账号，null 表示流水线所在账号
     * @param placeholderArn 带占位符的 ARN，null 时返回 null
     */
    public ExecutionRole resolve(String region, String account, String placeholderArn) {
        if (placeholderArn == null) {
            return null;
        }
        return imported.computeIfAbsent(placeholderArn, arn -> {
            String concrete = replace(arn, environment.partition(),
                region != null ? region : environment.region(),
                account != null ? account : environment.account());
            log.debug("Imported role {} as {}", arn, concrete);
            return ExecutionRole.fromArn(concrete);
        });
    }

    /**
     * 在流水线所在环境下替换占位符
     */
    public String substitute(String placeholderArn) {
        return replace(placeholderArn, environment.partition(), environment.region(), environment.account());
    }

    public static String replace(String value, String partition, String region, String account) {
        return value
            .replace(PARTITION, partition)
            .replace(REGION, region)
            .replace(ACCOUNT_ID, account);
    }

    public int importedCount() {
        return imported.size();
    }
}
