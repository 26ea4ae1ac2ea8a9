package com.eduhub.isolation;

import com.eduhub.security.TenantContext;
import com.eduhub.security.TenantContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.ConnectionProxy;
import org.springframework.jdbc.datasource.DelegatingDataSource;

import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Publishes the current tenant to the database session so storage-level row
 * policies can filter on it.
 *
 * Every checked-out connection gets the session setting
 * {@value #TENANT_SETTING} set to the tenant bound in
 * {@link TenantContextHolder}, or to an empty string when no tenant is bound.
 * The setting is cleared again before the connection goes back to the pool.
 */
public class TenantSessionDataSource extends DelegatingDataSource {
    
    private static final Logger log = LoggerFactory.getLogger(TenantSessionDataSource.class);
    
    public static final String TENANT_SETTING = "app.current_tenant";
    
    static final String SET_TENANT_SQL = "SELECT set_config(?, ?, false)";
    
    public TenantSessionDataSource(DataSource targetDataSource) {
        super(targetDataSource);
    }
    
    @Override
    public Connection getConnection() throws SQLException {
        return bindTenant(obtainTargetDataSource().getConnection());
    }
    
    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return bindTenant(obtainTargetDataSource().getConnection(username, password));
    }
    
    private Connection bindTenant(Connection target) throws SQLException {
        String tenantId = TenantContextHolder.current().map(TenantContext::getTenantId).orElse("");
        try {
            applySetting(target, tenantId);
        } catch (SQLException e) {
            target.close();
            throw e;
        }
        log.debug("Bound database session to tenant '{}'", tenantId);
        return (Connection) Proxy.newProxyInstance(
            ConnectionProxy.class.getClassLoader(),
            new Class<?>[] {ConnectionProxy.class},
            new TenantSessionInvocationHandler(target));
    }
    
    static void applySetting(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SET_TENANT_SQL)) {
            statement.setString(1, TENANT_SETTING);
            statement.setString(2, tenantId);
            statement.execute();
        }
    }
    
    private static final class TenantSessionInvocationHandler implements InvocationHandler {
        
        private final Connection target;
        private boolean closed;
        
        private TenantSessionInvocationHandler(Connection target) {
            this.target = target;
        }
        
        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "getTargetConnection":
                    return target;
                case "isClosed":
                    return closed || target.isClosed();
                case "close":
                    if (!closed) {
                        closed = true;
                        release();
                    }
                    return null;
                default:
                    break;
            }
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                throw e.getTargetException();
            }
        }
        
        private void release() throws SQLException {
            try {
                if (!target.isClosed()) {
                    applySetting(target, "");
                }
            } finally {
                target.close();
            }
        }
    }
}
