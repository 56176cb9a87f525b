package xyz.firestige.pipeline.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.api.blueprint.AssetType;
import xyz.firestige.pipeline.api.credential.CredentialUsage;
import xyz.firestige.pipeline.api.credential.EcrRegistryCredential;
import xyz.firestige.pipeline.api.credential.RegistryCredential;
import xyz.firestige.pipeline.api.model.ArtifactStore;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.api.model.PolicyStatement;
import xyz.firestige.pipeline.api.model.VpcConfig;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetRoleCacheTest {

    private static final PipelineEnvironment ENV = PipelineEnvironment.of("111111111111", "us-east-1");
    private static final String FILE_ROLE_A =
        "arn:${AWS::Partition}:iam::111111111111:role/cdk-hnb659fds-file-publishing-role-111111111111-us-east-1";
    private static final String FILE_ROLE_B =
        "arn:${AWS::Partition}:iam::222222222222:role/cdk-hnb659fds-file-publishing-role-222222222222-eu-west-1";

    private ArtifactStore store;
    private PlaceholderRoleResolver placeholders;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore("pipeline-artifacts", ENV);
        placeholders = new PlaceholderRoleResolver(ENV);
    }

    private AssetRoleCache cache(List<RegistryCredential> credentials, VpcConfig vpc) {
        return new AssetRoleCache(ENV, store, credentials, () -> vpc, placeholders);
    }

    private static PolicyStatement assumeRoleStatement(ExecutionRole role) {
        return role.getStatements().stream()
            .filter(s -> s.getActions().contains("sts:AssumeRole"))
            .findFirst()
            .orElseThrow();
    }

    @Test
    void obtain_sameType_returnsSameRole() {
        AssetRoleCache cache = cache(List.of(), null);

        SharedAssetRole first = cache.obtain(AssetType.FILE);
        SharedAssetRole second = cache.obtain(AssetType.FILE);

        assertThat(second.role()).isSameAs(first.role());
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void obtain_differentTypes_returnsDistinctRoles() {
        AssetRoleCache cache = cache(List.of(), null);

        ExecutionRole file = cache.obtain(AssetType.FILE).role();
        ExecutionRole docker = cache.obtain(AssetType.DOCKER_IMAGE).role();

        assertThat(file).isNotSameAs(docker);
        assertThat(file.getName()).isEqualTo("FileRole");
        assertThat(docker.getName()).isEqualTo("DockerRole");
    }

    @Test
    void obtain_grantsBaselinePermissions() {
        ExecutionRole role = cache(List.of(), null).obtain(AssetType.FILE).role();

        assertThat(role.isFrozen()).isTrue();
        assertThat(role.getAssumedBy()).containsExactly("codebuild.amazonaws.com", "arn:aws:iam::111111111111:root");
        assertThat(role.getStatements()).flatExtracting(PolicyStatement::getActions)
            .contains("logs:CreateLogGroup", "codebuild:CreateReportGroup", "codebuild:StartBuild",
                "sts:AssumeRole", "s3:GetObject*");
    }

    @Test
    void frozenRole_ignoresLaterGrants() {
        ExecutionRole role = cache(List.of(), null).obtain(AssetType.FILE).role();
        int before = role.getStatements().size();

        boolean added = role.addToPolicy(PolicyStatement.builder().actions("s3:PutObject").resources("*").build());

        assertThat(added).isFalse();
        assertThat(role.getStatements()).hasSize(before);
    }

    @Test
    void publishingRolesRegisteredAfterCreation_appearAfterFinalize() {
        AssetRoleCache cache = cache(List.of(), null);
        cache.registerPublishingRoles(AssetType.FILE, List.of(FILE_ROLE_A));
        ExecutionRole role = cache.obtain(AssetType.FILE).role();
        cache.registerPublishingRoles(AssetType.FILE, List.of(FILE_ROLE_B, FILE_ROLE_A));

        cache.finalizeRoles();

        assertThat(assumeRoleStatement(role).getResources()).containsExactly(
            "arn:aws:iam::111111111111:role/cdk-hnb659fds-file-publishing-role-111111111111-us-east-1",
            "arn:aws:iam::222222222222:role/cdk-hnb659fds-file-publishing-role-222222222222-eu-west-1");
    }

    @Test
    void assumeRoleResources_notReadableBeforeFinalize() {
        ExecutionRole role = cache(List.of(), null).obtain(AssetType.FILE).role();

        assertThatThrownBy(() -> assumeRoleStatement(role).getResources())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void register_afterFinalize_throws() {
        AssetRoleCache cache = cache(List.of(), null);
        cache.obtain(AssetType.FILE);
        cache.finalizeRoles();

        assertThatThrownBy(() -> cache.registerPublishingRoles(AssetType.FILE, List.of(FILE_ROLE_A)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void vpc_attachesVpcPolicyAsDependable() {
        VpcConfig vpc = new VpcConfig("vpc-1", List.of("subnet-a", "subnet-b"), List.of("sg-1"));

        SharedAssetRole shared = cache(List.of(), vpc).obtain(AssetType.FILE);

        assertThat(shared.dependable()).isNotNull();
        assertThat(shared.dependable().getName()).isEqualTo("VpcPolicy");
        assertThat(shared.role().getAttachedPolicies()).containsExactly(shared.dependable());
        PolicyStatement eni = shared.dependable().getStatements().get(0);
        assertThat(eni.getConditions().get("StringEquals").get("ec2:Subnet")).isEqualTo(List.of(
            "arn:aws:ec2:us-east-1:111111111111:subnet/subnet-a",
            "arn:aws:ec2:us-east-1:111111111111:subnet/subnet-b"));
    }

    @Test
    void noVpc_noDependable() {
        SharedAssetRole shared = cache(List.of(), null).obtain(AssetType.FILE);

        assertThat(shared.dependable()).isNull();
        assertThat(shared.role().getAttachedPolicies()).isEmpty();
    }

    @Test
    void registryCredentials_grantedToDockerRoleOnly() {
        EcrRegistryCredential ecr = new EcrRegistryCredential("111111111111.dkr.ecr.us-east-1.amazonaws.com",
            List.of("arn:aws:ecr:us-east-1:111111111111:repository/base"), Set.of(CredentialUsage.ASSET_PUBLISHING));
        AssetRoleCache cache = cache(List.of(ecr), null);

        ExecutionRole docker = cache.obtain(AssetType.DOCKER_IMAGE).role();
        ExecutionRole file = cache.obtain(AssetType.FILE).role();

        assertThat(docker.getStatements()).flatExtracting(PolicyStatement::getActions).contains("ecr:BatchGetImage");
        assertThat(file.getStatements()).flatExtracting(PolicyStatement::getActions).doesNotContain("ecr:BatchGetImage");
    }

    @Test
    void close_rejectsFurtherReads() {
        AssetRoleCache cache = cache(List.of(), null);
        cache.obtain(AssetType.FILE);
        cache.finalizeRoles();
        cache.close();

        assertThat(cache.isClosed()).isTrue();
        assertThatThrownBy(() -> cache.roleFor(AssetType.FILE)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cache.publishingRolesFor(AssetType.FILE)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void snapshot_containsCreatedRoles() {
        AssetRoleCache cache = cache(List.of(), null);
        ExecutionRole file = cache.obtain(AssetType.FILE).role();

        assertThat(cache.snapshot()).containsOnlyKeys(AssetType.FILE);
        assertThat(cache.snapshot().get(AssetType.FILE)).isSameAs(file);
        assertThat(cache.roleFor(AssetType.DOCKER_IMAGE)).isEmpty();
    }
}
