package xyz.firestige.pipeline.api.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionRoleTest {

    private static PolicyStatement statement(String action) {
        return PolicyStatement.builder().actions(action).resources("*").build();
    }

    @Test
    void create_acceptsPolicyUpdates() {
        ExecutionRole role = ExecutionRole.create("BuildRole", "codebuild.amazonaws.com");

        assertThat(role.addToPolicy(statement("s3:GetObject"))).isTrue();
        assertThat(role.getStatements()).hasSize(1);
        assertThat(role.isImported()).isFalse();
        assertThat(role.getAssumedBy()).containsExactly("codebuild.amazonaws.com");
    }

    @Test
    void withoutPolicyUpdates_ignoresGrantsButKeepsBaseline() {
        ExecutionRole role = ExecutionRole.create("FileRole");
        role.addToPolicy(statement("logs:PutLogEvents"));

        ExecutionRole frozen = role.withoutPolicyUpdates();

        assertThat(frozen.isFrozen()).isTrue();
        assertThat(frozen.addToPolicy(statement("s3:PutObject"))).isFalse();
        assertThat(frozen.attachInlinePolicy(new AttachedPolicy("Extra", List.of()))).isFalse();
        assertThat(frozen.getStatements()).extracting(s -> s.getActions().get(0))
            .containsExactly("logs:PutLogEvents");
        assertThat(frozen.withoutPolicyUpdates()).isSameAs(frozen);
    }

    @Test
    void withoutPolicyUpdates_sharesStatementsWithOriginal() {
        ExecutionRole role = ExecutionRole.create("FileRole");
        ExecutionRole frozen = role.withoutPolicyUpdates();

        role.addToPolicy(statement("codebuild:StartBuild"));

        assertThat(frozen.getStatements()).hasSize(1);
    }

    @Test
    void fromArn_isImportedAndFrozen() {
        ExecutionRole role = ExecutionRole.fromArn("arn:aws:iam::111111111111:role/deploy-role");

        assertThat(role.isImported()).isTrue();
        assertThat(role.isFrozen()).isTrue();
        assertThat(role.getName()).isEqualTo("deploy-role");
        assertThat(role.addToPolicy(statement("s3:GetObject"))).isFalse();
    }

    @Test
    void finalizeStatements_resolvesDeferredInAttachedPolicies() {
        ExecutionRole role = ExecutionRole.create("DockerRole");
        PolicyStatement deferred = PolicyStatement.builder()
            .actions("sts:AssumeRole")
            .deferredResources(() -> List.of("roleA"))
            .build();
        PolicyStatement attached = PolicyStatement.builder()
            .actions("ec2:Describe*")
            .deferredResources(() -> List.of("*"))
            .build();
        role.addToPolicy(deferred);
        role.attachInlinePolicy(new AttachedPolicy("VpcPolicy", List.of(attached)));

        role.withoutPolicyUpdates().finalizeStatements();

        assertThat(deferred.getResources()).containsExactly("roleA");
        assertThat(attached.getResources()).containsExactly("*");
    }
}
