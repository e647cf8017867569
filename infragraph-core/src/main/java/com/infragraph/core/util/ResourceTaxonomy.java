package com.infragraph.core.util;

import com.infragraph.core.model.ResourceCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup tables that classify resource type strings.
 *
 * <p>All functions are pure: they depend only on the type string, so re-running on
 * identical input always yields identical tags.
 *
 * <p><b>Keyword matching</b></p>
 *
 * <p>A type is split into lowercase tokens on {@code _ : . / - @} and camelCase
 * boundaries ({@code Microsoft.Network/virtualNetworks} becomes {@code microsoft,
 * network, virtual, networks}). A keyword matches a token equal to the keyword or its
 * plural ({@code +s}, {@code +es}); a multi-word keyword matches consecutive tokens.
 * Token matching keeps short keywords such as {@code lb} or {@code key} from matching
 * inside unrelated words.
 */
public final class ResourceTaxonomy {

    /** Provider tag for types whose prefix is not in the table. */
    public static final String OTHER_PROVIDER = "other";

    private static final Map<String, String> PROVIDER_PREFIXES = Map.ofEntries(
        Map.entry("aws", "aws"),
        Map.entry("azurerm", "azure"),
        Map.entry("azuread", "azure"),
        Map.entry("azapi", "azure"),
        Map.entry("azure", "azure"),
        Map.entry("azure-native", "azure"),
        Map.entry("microsoft", "azure"),
        Map.entry("google", "gcp"),
        Map.entry("google-beta", "gcp"),
        Map.entry("gcp", "gcp"),
        Map.entry("oci", "oci"),
        Map.entry("ibm", "ibm"),
        Map.entry("kubernetes", "kubernetes"),
        Map.entry("helm", "kubernetes"),
        Map.entry("k8s", "kubernetes"),
        Map.entry("alicloud", "alicloud")
    );

    private static final Map<String, String> PROVIDER_LABELS = Map.of(
        "aws", "AWS",
        "azure", "Azure",
        "gcp", "GCP",
        "oci", "OCI",
        "ibm", "IBM",
        "kubernetes", "Kubernetes",
        "alicloud", "Alibaba Cloud",
        OTHER_PROVIDER, "Other"
    );

    private static final Map<ResourceCategory, List<String>> CATEGORY_KEYWORDS = categoryKeywords();

    private static final List<String> SECURITY_KEYWORDS = List.of(
        "security", "firewall", "iam", "kms", "key", "policy", "role", "nsg", "nacl", "waf", "acl");

    private static final List<String> DATA_FLOW_KEYWORDS = dataFlowKeywords();

    private static final List<String> CONTAINER_SUFFIXES = List.of("vpc", "vnet", "vcn", "virtual network", "network");

    private static final List<String> SUB_CONTAINER_SUFFIXES = List.of("subnet", "subnetwork");

    private static final Set<Character> SEPARATORS = Set.of('_', ':', '.', '/', '-', '@', ' ');

    private ResourceTaxonomy() {
        // Prevent instantiation
    }

    // ==================== Providers ====================

    /**
     * Derives the provider tag from the type prefix (text before the first
     * {@code _ : . /}).
     *
     * @param type resource type
     * @return provider tag, {@value #OTHER_PROVIDER} when unknown
     */
    public static String provider(String type) {
        if (type == null || type.isBlank()) {
            return OTHER_PROVIDER;
        }
        String lower = type.strip().toLowerCase(Locale.ROOT);
        int end = lower.length();
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == '_' || c == ':' || c == '.' || c == '/') {
                end = i;
                break;
            }
        }
        return PROVIDER_PREFIXES.getOrDefault(lower.substring(0, end), OTHER_PROVIDER);
    }

    /**
     * Returns the display label of a provider tag.
     *
     * @param provider provider tag
     * @return label such as {@code AWS}; the tag itself when unknown
     */
    public static String providerLabel(String provider) {
        return PROVIDER_LABELS.getOrDefault(provider, provider);
    }

    // ==================== Categories ====================

    /**
     * Maps a type to its category; the first category in precedence order with a
     * matching keyword wins.
     *
     * @param type resource type
     * @return category, {@link ResourceCategory#OTHER} when nothing matches
     */
    public static ResourceCategory category(String type) {
        List<String> tokens = tokenize(type);
        for (Map.Entry<ResourceCategory, List<String>> entry : CATEGORY_KEYWORDS.entrySet()) {
            if (matchesAny(tokens, entry.getValue())) {
                return entry.getKey();
            }
        }
        return ResourceCategory.OTHER;
    }

    /**
     * Returns true if the type names a security control (security group, firewall, IAM,
     * key, policy, ACL, ...).
     *
     * @param type resource type
     * @return true for security types
     */
    public static boolean isSecurityType(String type) {
        return matchesAny(tokenize(type), SECURITY_KEYWORDS);
    }

    /**
     * Returns true if the type holds or moves data (databases, storage, queues, streams).
     *
     * @param type resource type
     * @return true for data and storage types
     */
    public static boolean isDataOrStorageType(String type) {
        return matchesAny(tokenize(type), DATA_FLOW_KEYWORDS);
    }

    // ==================== Network Containment ====================

    /**
     * Returns true for network containers (VPC, virtual network, VCN, network).
     *
     * @param type resource type
     * @return true if the type's last words name a network
     */
    public static boolean isContainer(String type) {
        List<String> tokens = tokenize(type);
        return !isSubContainer(type) && CONTAINER_SUFFIXES.stream().anyMatch(suffix -> endsWith(tokens, suffix));
    }

    /**
     * Returns true for sub-containers (subnet, subnetwork).
     *
     * @param type resource type
     * @return true if the type's last word names a subnet
     */
    public static boolean isSubContainer(String type) {
        List<String> tokens = tokenize(type);
        return SUB_CONTAINER_SUFFIXES.stream().anyMatch(suffix -> endsWith(tokens, suffix));
    }

    // ==================== Tokenization ====================

    /**
     * Splits a type into lowercase words.
     *
     * @param type resource type
     * @return tokens in order
     */
    public static List<String> tokenize(String type) {
        List<String> tokens = new ArrayList<>();
        if (type == null) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < type.length(); i++) {
            char c = type.charAt(i);
            if (SEPARATORS.contains(c)) {
                flush(current, tokens);
                continue;
            }
            if (Character.isUpperCase(c) && current.length() > 0) {
                char previous = type.charAt(i - 1);
                boolean nextIsLower = i + 1 < type.length() && Character.isLowerCase(type.charAt(i + 1));
                if (Character.isLowerCase(previous) || Character.isDigit(previous)
                    || (Character.isUpperCase(previous) && nextIsLower)) {
                    flush(current, tokens);
                }
            }
            current.append(Character.toLowerCase(c));
        }
        flush(current, tokens);
        return tokens;
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }

    private static boolean matchesAny(List<String> tokens, List<String> keywords) {
        for (String keyword : keywords) {
            String[] words = keyword.split(" ");
            for (int start = 0; start + words.length <= tokens.size(); start++) {
                if (matchesAt(tokens, start, words)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean endsWith(List<String> tokens, String keyword) {
        String[] words = keyword.split(" ");
        int start = tokens.size() - words.length;
        return start >= 0 && matchesAt(tokens, start, words);
    }

    private static boolean matchesAt(List<String> tokens, int start, String[] words) {
        for (int i = 0; i < words.length; i++) {
            if (!wordMatches(tokens.get(start + i), words[i])) {
                return false;
            }
        }
        return true;
    }

    private static boolean wordMatches(String token, String word) {
        return token.equals(word) || token.equals(word + "s") || token.equals(word + "es");
    }

    private static Map<ResourceCategory, List<String>> categoryKeywords() {
        Map<ResourceCategory, List<String>> keywords = new EnumMap<>(ResourceCategory.class);
        keywords.put(ResourceCategory.NETWORK, List.of(
            "vpc", "vnet", "vcn", "subnet", "subnetwork", "route", "route53", "gateway", "internet", "nat",
            "network", "virtual network", "lb", "elb", "alb", "nlb", "load balancer", "loadbalancer", "eip",
            "public ip", "publicip", "dns", "cdn", "cloudfront", "front door", "frontdoor", "peering",
            "private link", "privatelink", "endpoint", "interface"));
        keywords.put(ResourceCategory.SECURITY, List.of(
            "security", "firewall", "iam", "policy", "role", "key", "kms", "nsg", "nacl", "acl", "waf",
            "secret", "vault", "keyvault", "certificate", "acm", "identity", "shield", "guardduty",
            "permission", "service account"));
        keywords.put(ResourceCategory.COMPUTE, List.of(
            "instance", "vm", "virtual machine", "virtualmachine", "compute", "ec2", "app service", "function",
            "lambda", "eks", "aks", "gke", "ecs", "kubernetes", "container", "fargate", "autoscaling",
            "scale set", "batch", "web app", "webapp", "site", "beanstalk", "deployment", "pod"));
        keywords.put(ResourceCategory.DATA, List.of(
            "db", "database", "sql", "rds", "dynamodb", "cosmos", "cosmosdb", "redis", "elasticache",
            "postgresql", "mysql", "mariadb", "aurora", "docdb", "neptune", "redshift", "bigtable",
            "spanner", "firestore", "memorystore", "cache", "elasticsearch", "opensearch"));
        keywords.put(ResourceCategory.STORAGE, List.of(
            "bucket", "storage", "objectstorage", "object storage", "blob", "s3", "efs", "ebs", "volume",
            "disk", "file share", "share", "file system", "filesystem", "glacier", "backup", "snapshot", "fsx"));
        keywords.put(ResourceCategory.INTEGRATION, List.of(
            "queue", "sqs", "sns", "topic", "stream", "kinesis", "eventbridge", "event grid", "eventgrid",
            "event hub", "eventhub", "service bus", "servicebus", "pubsub", "api", "logic app", "workflow",
            "step function", "sfn", "mq", "msk", "kafka"));
        keywords.put(ResourceCategory.MANAGEMENT, List.of(
            "cloudwatch", "monitor", "monitoring", "log", "logging", "alarm", "metric", "dashboard",
            "insight", "cloudtrail", "config", "resource group", "ssm", "parameter", "budget", "automation",
            "diagnostic", "action group", "project", "organization", "folder", "stack"));
        return Collections.unmodifiableMap(keywords);
    }

    private static List<String> dataFlowKeywords() {
        List<String> keywords = new ArrayList<>(CATEGORY_KEYWORDS.get(ResourceCategory.DATA));
        keywords.addAll(CATEGORY_KEYWORDS.get(ResourceCategory.STORAGE));
        keywords.addAll(List.of("queue", "stream", "kinesis", "pubsub", "eventgrid", "event grid", "topic"));
        return List.copyOf(keywords);
    }
}
