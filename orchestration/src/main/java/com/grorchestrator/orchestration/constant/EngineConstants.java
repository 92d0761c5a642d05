package com.grorchestrator.orchestration.constant;

import java.util.List;

/**
 * MySQL Shell scripts executed in python mode. Arguments are passed through environment variables, so nothing
 * sensitive appears in process arguments.
 */
public class EngineConstants {
    public static final String RESULT_MARKER = "GR_RESULT:";
    public static final String ENV_ARG_PREFIX = "GR_ARG_";

    public static final String ARG_CLUSTER_NAME = "CLUSTER_NAME";
    public static final String ARG_NODE_ID = "NODE_ID";
    public static final String ARG_ENDPOINT = "ENDPOINT";
    public static final String ARG_FORCE = "FORCE";
    public static final String ARG_CLUSTER_SET_NAME = "CLUSTER_SET_NAME";
    public static final String ARG_DOMAIN_ID = "DOMAIN_ID";
    public static final String ARG_USERNAME = "USERNAME";
    public static final String ARG_PASSWORD = "PASSWORD";
    public static final String ARG_HOST = "HOST";
    public static final String ARG_GRANTS = "GRANTS";
    public static final String ARG_ACCOUNTS_JSON = "ACCOUNTS_JSON";
    public static final String ARG_SETTINGS_JSON = "SETTINGS_JSON";
    public static final String ARG_ENABLED = "ENABLED";

    public static final String CLUSTER_ADMIN_GRANTS = "ALL PRIVILEGES ON *.* TO {} WITH GRANT OPTION";
    public static final String SERVER_CONFIG_GRANTS = "ALL PRIVILEGES ON *.* TO {} WITH GRANT OPTION";
    public static final String MONITORING_GRANTS = "SELECT, PROCESS, SUPER, REPLICATION CLIENT, RELOAD ON *.* TO {}";
    public static final String BACKUPS_GRANTS = "BACKUP_ADMIN, PROCESS, RELOAD, LOCK TABLES, REPLICATION CLIENT, SELECT ON *.* TO {}";
    public static final String ROOT_GRANTS = "ALL PRIVILEGES ON *.* TO {} WITH GRANT OPTION";
    public static final String RELATION_GRANTS_FORMAT = "ALL PRIVILEGES ON `%s`.* TO {}";

    public static final List<String> TRANSIENT_ERROR_MARKERS = List.of(
            "Can't connect",
            "Lost connection",
            "MySQL Error 2003",
            "MySQL Error 2013",
            "MySQL Error 2006",
            "Timeout",
            "timed out",
            "Deadlock found",
            "Lock wait timeout",
            "group is not yet ready",
            "no quorum"
    );

    public static final List<String> NO_CLUSTER_MARKERS = List.of(
            "51314",
            "not part of any cluster",
            "standalone instance"
    );

    private static final String COMMON_HEADER = String.join("\n",
            "import json, os",
            "def arg(name):",
            "    return os.environ.get('" + ENV_ARG_PREFIX + "' + name, '')",
            "def emit(result):",
            "    print('" + RESULT_MARKER + "' + json.dumps(result))",
            ""
    );

    public static final String CLUSTER_STATUS_SCRIPT = COMMON_HEADER + String.join("\n",
            "try:",
            "    cluster = dba.get_cluster()",
            "except Exception as e:",
            "    if any(marker in str(e) for marker in " + pythonList(NO_CLUSTER_MARKERS) + "):",
            "        emit({'exists': False, 'members': []})",
            "        raise SystemExit(0)",
            "    raise",
            "status = cluster.status()",
            "applied = {}",
            "for row in session.run_sql(\"SELECT m.MEMBER_HOST, m.MEMBER_PORT, s.COUNT_TRANSACTIONS_REMOTE_APPLIED FROM performance_schema.replication_group_members m JOIN performance_schema.replication_group_member_stats s USING (MEMBER_ID)\").fetch_all():",
            "    applied['%s:%s' % (row[0], row[1])] = int(row[2] or 0)",
            "members = []",
            "for label, member in status['defaultReplicaSet']['topology'].items():",
            "    members.append({'nodeId': label, 'address': member['address'], 'state': member['status'],",
            "                    'primary': member.get('memberRole') == 'PRIMARY', 'applied': applied.get(member['address'], 0)})",
            "emit({'exists': True, 'clusterName': status['clusterName'], 'members': members})"
    );

    public static final String CONFIGURE_INSTANCE_SCRIPT = COMMON_HEADER + String.join("\n",
            "accounts = json.loads(arg('" + ARG_ACCOUNTS_JSON + "'))",
            "session.run_sql('SET SESSION sql_log_bin = 0')",
            "for account in accounts:",
            "    user = \"'%s'@'%s'\" % (account['username'], account['host'])",
            "    session.run_sql('CREATE USER IF NOT EXISTS ' + user + ' IDENTIFIED BY ?', [account['password']])",
            "    session.run_sql('ALTER USER ' + user + ' IDENTIFIED BY ?', [account['password']])",
            "    session.run_sql('GRANT ' + account['grants'].replace('{}', user))",
            "session.run_sql('SET SESSION sql_log_bin = 1')",
            "dba.configure_instance(None, {'clusterAdmin': 'clusteradmin', 'restart': False})",
            "emit({'configured': True})"
    );

    public static final String APPLY_SETTINGS_SCRIPT = COMMON_HEADER + String.join("\n",
            "settings = json.loads(arg('" + ARG_SETTINGS_JSON + "'))",
            "for name, value in settings.items():",
            "    try:",
            "        session.run_sql('SET PERSIST ' + name + ' = ' + value)",
            "    except Exception as e:",
            "        if '1238' not in str(e):",
            "            raise",
            "        session.run_sql('SET PERSIST_ONLY ' + name + ' = ' + value)",
            "emit({'applied': len(settings)})"
    );

    public static final String CREATE_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "try:",
            "    cluster = dba.get_cluster()",
            "    emit({'created': False, 'clusterName': cluster.get_name()})",
            "except Exception:",
            "    cluster = dba.create_cluster(arg('" + ARG_CLUSTER_NAME + "'), {'communicationStack': 'MySQL', 'memberSslMode': 'REQUIRED'})",
            "    cluster.set_instance_option(arg('" + ARG_ENDPOINT + "'), 'label', arg('" + ARG_NODE_ID + "'))",
            "    emit({'created': True, 'clusterName': cluster.get_name()})"
    );

    public static final String ADD_INSTANCE_SCRIPT = COMMON_HEADER + String.join("\n",
            "cluster = dba.get_cluster()",
            "topology = cluster.status()['defaultReplicaSet']['topology']",
            "if any(m['address'] == arg('" + ARG_ENDPOINT + "') or label == arg('" + ARG_NODE_ID + "') for label, m in topology.items()):",
            "    emit({'added': False})",
            "else:",
            "    cluster.add_instance(arg('" + ARG_ENDPOINT + "'), {'label': arg('" + ARG_NODE_ID + "'), 'recoveryMethod': 'auto'})",
            "    emit({'added': True})"
    );

    public static final String REMOVE_INSTANCE_SCRIPT = COMMON_HEADER + String.join("\n",
            "cluster = dba.get_cluster()",
            "topology = cluster.status()['defaultReplicaSet']['topology']",
            "if not any(m['address'] == arg('" + ARG_ENDPOINT + "') for m in topology.values()):",
            "    emit({'removed': False})",
            "else:",
            "    cluster.remove_instance(arg('" + ARG_ENDPOINT + "'), {'force': arg('" + ARG_FORCE + "') == 'true'})",
            "    emit({'removed': True})"
    );

    public static final String REJOIN_INSTANCE_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.get_cluster().rejoin_instance(arg('" + ARG_ENDPOINT + "'))",
            "emit({'rejoined': True})"
    );

    public static final String SET_PRIMARY_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.get_cluster().set_primary_instance(arg('" + ARG_ENDPOINT + "'))",
            "emit({'primary': arg('" + ARG_ENDPOINT + "')})"
    );

    public static final String DISSOLVE_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "try:",
            "    cluster = dba.get_cluster()",
            "except Exception:",
            "    emit({'dissolved': False})",
            "    raise SystemExit(0)",
            "cluster.dissolve({'force': True})",
            "emit({'dissolved': True})"
    );

    public static final String REBOOT_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.reboot_cluster_from_complete_outage(arg('" + ARG_CLUSTER_NAME + "'))",
            "emit({'rebooted': True})"
    );

    public static final String EXECUTED_GTID_SET_SCRIPT = COMMON_HEADER + String.join("\n",
            "row = session.run_sql('SELECT @@GLOBAL.gtid_executed').fetch_one()",
            "emit({'gtidExecuted': row[0]})"
    );

    public static final String CREATE_CLUSTER_SET_SCRIPT = COMMON_HEADER + String.join("\n",
            "cluster = dba.get_cluster()",
            "try:",
            "    cluster_set = cluster.get_cluster_set()",
            "    emit({'created': False})",
            "except Exception:",
            "    cluster.create_cluster_set(arg('" + ARG_CLUSTER_SET_NAME + "'))",
            "    emit({'created': True})"
    );

    public static final String CLUSTER_SET_STATUS_SCRIPT = COMMON_HEADER + String.join("\n",
            "try:",
            "    status = dba.get_cluster_set().status()",
            "except Exception:",
            "    emit({'exists': False})",
            "    raise SystemExit(0)",
            "clusters = []",
            "for name, cluster in status['clusters'].items():",
            "    clusters.append({'clusterName': name, 'role': cluster.get('clusterRole'), 'globalStatus': cluster.get('globalStatus'), 'primary': cluster.get('primary')})",
            "emit({'exists': True, 'clusterSetName': status['domainName'], 'primaryCluster': status['primaryCluster'], 'clusters': clusters})"
    );

    public static final String CREATE_REPLICA_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "cluster_set = dba.get_cluster_set()",
            "if arg('" + ARG_CLUSTER_NAME + "') in cluster_set.status()['clusters']:",
            "    emit({'created': False})",
            "else:",
            "    cluster_set.create_replica_cluster(arg('" + ARG_ENDPOINT + "'), arg('" + ARG_CLUSTER_NAME + "'), {'recoveryMethod': 'clone'})",
            "    emit({'created': True})"
    );

    public static final String SET_PRIMARY_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.get_cluster_set().set_primary_cluster(arg('" + ARG_CLUSTER_NAME + "'))",
            "emit({'primaryCluster': arg('" + ARG_CLUSTER_NAME + "')})"
    );

    public static final String FORCE_PRIMARY_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.get_cluster_set().force_primary_cluster(arg('" + ARG_CLUSTER_NAME + "'))",
            "emit({'primaryCluster': arg('" + ARG_CLUSTER_NAME + "')})"
    );

    public static final String REJOIN_CLUSTER_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.get_cluster_set().rejoin_cluster(arg('" + ARG_CLUSTER_NAME + "'))",
            "emit({'rejoined': arg('" + ARG_CLUSTER_NAME + "')})"
    );

    public static final String UPSERT_ACCOUNT_SCRIPT = COMMON_HEADER + String.join("\n",
            "user = \"'%s'@'%s'\" % (arg('" + ARG_USERNAME + "'), arg('" + ARG_HOST + "'))",
            "session.run_sql('CREATE USER IF NOT EXISTS ' + user + ' IDENTIFIED BY ?', [arg('" + ARG_PASSWORD + "')])",
            "session.run_sql('ALTER USER ' + user + ' IDENTIFIED BY ?', [arg('" + ARG_PASSWORD + "')])",
            "session.run_sql('GRANT ' + arg('" + ARG_GRANTS + "').replace('{}', user))",
            "emit({'upserted': True})"
    );

    public static final String DROP_ACCOUNT_SCRIPT = COMMON_HEADER + String.join("\n",
            "session.run_sql(\"DROP USER IF EXISTS '%s'@'%s'\" % (arg('" + ARG_USERNAME + "'), arg('" + ARG_HOST + "')))",
            "emit({'dropped': True})"
    );

    public static final String SET_HIDDEN_SCRIPT = COMMON_HEADER + String.join("\n",
            "dba.get_cluster().set_instance_option(arg('" + ARG_ENDPOINT + "'), 'tag:_hidden', arg('" + ARG_ENABLED + "') == 'true')",
            "emit({'hidden': arg('" + ARG_ENABLED + "') == 'true'})"
    );

    public static final String SET_OFFLINE_MODE_SCRIPT = COMMON_HEADER + String.join("\n",
            "session.run_sql('SET GLOBAL offline_mode = ' + ('ON' if arg('" + ARG_ENABLED + "') == 'true' else 'OFF'))",
            "emit({'offlineMode': arg('" + ARG_ENABLED + "') == 'true'})"
    );

    public static final String RELOAD_TLS_SCRIPT = COMMON_HEADER + String.join("\n",
            "session.run_sql('ALTER INSTANCE RELOAD TLS')",
            "emit({'reloaded': True})"
    );

    private static String pythonList(List<String> values) {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append("'").append(values.get(i).replace("'", "\\'")).append("'");
        }
        return builder.append("]").toString();
    }

    private EngineConstants() {
    }
}
