package xyz.firestige.pipeline.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.SharedRoleView;
import xyz.firestige.pipeline.api.blueprint.AssetType;
import xyz.firestige.pipeline.api.credential.CredentialUsage;
import xyz.firestige.pipeline.api.credential.RegistryCredential;
import xyz.firestige.pipeline.api.model.ArtifactStore;
import xyz.firestige.pipeline.api.model.AttachedPolicy;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.api.model.PolicyStatement;
import xyz.firestige.pipeline.api.model.VpcConfig;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 资产发布共享角色缓存
 *
 * <p>每种资产类型只创建一个发布角色，第一次请求时构造，之后的请求复用同一个对象。
 * 角色的基线权限：
 * <ul>
 *   <li>日志写入</li>
 *   <li>构建报告</li>
 *   <li>构建启停</li>
 *   <li>扮演发布角色（延迟声明，资源为整个编译期间登记的发布角色 ARN）</li>
 *   <li>镜像仓库凭证读取（仅容器镜像）</li>
 *   <li>制品存储读取</li>
 * </ul>
 * 资产构建默认配置带有 VPC 时，额外挂载 VpcPolicy 策略并作为依赖返回。
 *
 * <p>生命周期：编译遍历结束后调用 {@link #finalizeRoles()} 固化延迟声明，
 * 再调用 {@link #close()} 关闭只读视图。
 *
 * @since 1.0
 */
public class AssetRoleCache implements SharedRoleView {

    private static final Logger log = LoggerFactory.getLogger(AssetRoleCache.class);

    static final String BUILD_SERVICE_PRINCIPAL = "codebuild.amazonaws.com";

    private final PipelineEnvironment environment;
    private final ArtifactStore artifactStore;
    private final List<RegistryCredential> registryCredentials;
    private final Supplier<VpcConfig> assetVpc;
    private final PlaceholderRoleResolver placeholders;

    private final Map<AssetType, SharedAssetRole> roles = new EnumMap<>(AssetType.class);
    private final Map<AssetType, Set<String>> publishingRoles = new EnumMap<>(AssetType.class);
    private final List<ExecutionRole> created = new ArrayList<>();

    private boolean finalized = false;
    private boolean closed = false;

    /**
     * @param assetVpc 资产构建默认配置中的 VPC，首次创建角色时读取
     */
    public AssetRoleCache(PipelineEnvironment environment,
                          ArtifactStore artifactStore,
                          List<RegistryCredential> registryCredentials,
                          Supplier<VpcConfig> assetVpc,
                          PlaceholderRoleResolver placeholders) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore cannot be null");
        this.registryCredentials = List.copyOf(registryCredentials);
        this.assetVpc = Objects.requireNonNull(assetVpc, "assetVpc cannot be null");
        this.placeholders = Objects.requireNonNull(placeholders, "placeholders cannot be null");
    }

    /**
     * 登记某资产类型需要扮演的发布角色（去重，保持登记顺序）
     */
    public void registerPublishingRoles(AssetType assetType, Collection<String> roleArns) {
        checkOpen();
        if (finalized) {
            throw new IllegalStateException("Publishing roles registered after finalization: " + assetType);
        }
        Set<String> set = publishingRoles.computeIfAbsent(assetType, k -> new LinkedHashSet<>());
        for (String arn : roleArns) {
            if (arn != null && set.add(arn)) {
                log.debug("Registered publishing role {} for {}", arn, assetType);
            }
        }
    }

    /**
     * 获取某资产类型的共享角色，首次调用时创建
     */
    public SharedAssetRole obtain(AssetType assetType) {
        checkOpen();
        SharedAssetRole existing = roles.get(assetType);
        if (existing != null) {
            log.debug("Reusing shared {} publishing role", assetType);
            return existing;
        }
        if (finalized) {
            throw new IllegalStateException("Shared role requested after finalization: " + assetType);
        }

        ExecutionRole role = ExecutionRole.create(assetType.getRolePrefix() + "Role",
            BUILD_SERVICE_PRINCIPAL, "arn:" + environment.partition() + ":iam::" + environment.account() + ":root");

        role.addToPolicy(PolicyStatement.builder()
            .actions("logs:CreateLogGroup", "logs:CreateLogStream", "logs:PutLogEvents")
            .resources(environment.formatArn("logs", "log-group", ":", "/aws/codebuild/*"))
            .build());
        role.addToPolicy(PolicyStatement.builder()
            .actions("codebuild:CreateReportGroup", "codebuild:CreateReport", "codebuild:UpdateReport",
                "codebuild:BatchPutTestCases", "codebuild:BatchPutCodeCoverages")
            .resources(environment.formatArn("codebuild", "report-group", "/", "*"))
            .build());
        role.addToPolicy(PolicyStatement.builder()
            .actions("codebuild:BatchGetBuilds", "codebuild:StartBuild", "codebuild:StopBuild")
            .resources("*")
            .build());
        role.addToPolicy(PolicyStatement.builder()
            .actions("sts:AssumeRole")
            .deferredResources(() -> publishingRolesFor(assetType).stream()
                .map(placeholders::substitute)
                .toList())
            .build());

        if (assetType == AssetType.DOCKER_IMAGE) {
            registryCredentials.forEach(c -> c.grantRead(role, CredentialUsage.ASSET_PUBLISHING));
        }

        artifactStore.grantRead(role);

        AttachedPolicy dependable = null;
        VpcConfig vpc = assetVpc.get();
        if (vpc != null) {
            dependable = vpcPolicy(vpc);
            role.attachInlinePolicy(dependable);
        }

        created.add(role);
        SharedAssetRole shared = new SharedAssetRole(role.withoutPolicyUpdates(), dependable);
        roles.put(assetType, shared);
        log.debug("Created shared {} publishing role {}", assetType, role.getName());
        return shared;
    }

    private AttachedPolicy vpcPolicy(VpcConfig vpc) {
        String prefix = "arn:" + environment.partition() + ":ec2:" + environment.region() + ":" + environment.account();
        List<String> subnets = vpc.subnetIds().stream()
            .map(id -> prefix + ":subnet/" + id)
            .toList();
        return new AttachedPolicy("VpcPolicy", List.of(
            PolicyStatement.builder()
                .actions("ec2:CreateNetworkInterfacePermission")
                .resources(prefix + ":network-interface/*")
                .condition("StringEquals", "ec2:Subnet", subnets)
                .condition("StringEquals", "ec2:AuthorizedService", BUILD_SERVICE_PRINCIPAL)
                .build(),
            PolicyStatement.builder()
                .actions("ec2:CreateNetworkInterface", "ec2:DescribeNetworkInterfaces",
                    "ec2:DeleteNetworkInterface", "ec2:DescribeSubnets", "ec2:DescribeSecurityGroups",
                    "ec2:DescribeDhcpOptions", "ec2:DescribeVpcs")
                .resources("*")
                .build()));
    }

    /**
     * 固化所有共享角色中的延迟声明，只执行一次
     */
    public void finalizeRoles() {
        checkOpen();
        if (finalized) {
            return;
        }
        created.forEach(ExecutionRole::finalizeStatements);
        finalized = true;
        log.debug("Finalized {} shared publishing role(s)", created.size());
    }

    public void close() {
        closed = true;
    }

    @Override
    public Optional<ExecutionRole> roleFor(AssetType assetType) {
        checkOpen();
        return Optional.ofNullable(roles.get(assetType)).map(SharedAssetRole::role);
    }

    @Override
    public Set<String> publishingRolesFor(AssetType assetType) {
        checkOpen();
        Set<String> set = publishingRoles.get(assetType);
        return set == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * 已创建的共享角色（冻结视图）
     */
    public Map<AssetType, ExecutionRole> snapshot() {
        Map<AssetType, ExecutionRole> result = new EnumMap<>(AssetType.class);
        roles.forEach((type, shared) -> result.put(type, shared.role()));
        return result;
    }

    public int size() {
        return roles.size();
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Shared role cache is closed");
        }
    }
}
