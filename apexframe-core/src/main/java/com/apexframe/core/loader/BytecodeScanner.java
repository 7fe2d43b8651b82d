package com.apexframe.core.loader;

import com.apexframe.api.security.Permissions;
import lombok.extern.slf4j.Slf4j;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * 使用 ASM 扫描代码单元中的敏感调用
 * <p>
 * 终止 JVM 的调用直接拒绝；进程执行、原始网络连接与文件写入折算为所需权限，
 * 由 initialize 对照授权集合检查。
 * </p>
 */
@Slf4j
public class BytecodeScanner {

    private static final Set<String> FORBIDDEN_METHODS = Set.of(
            "java/lang/System.exit(I)V",
            "java/lang/Runtime.exit(I)V",
            "java/lang/Runtime.halt(I)V");

    // owner.method 前缀 -> 权限
    private static final Map<String, String> PERMISSION_METHODS = Map.ofEntries(
            Map.entry("java/lang/Runtime.exec", Permissions.SYSTEM_EXECUTE),
            Map.entry("java/lang/ProcessBuilder.start", Permissions.SYSTEM_EXECUTE),
            Map.entry("java/net/Socket.<init>", Permissions.NETWORK_CONNECT),
            Map.entry("java/net/Socket.connect", Permissions.NETWORK_CONNECT),
            Map.entry("java/net/ServerSocket.<init>", Permissions.NETWORK_CONNECT),
            Map.entry("java/net/DatagramSocket.<init>", Permissions.NETWORK_CONNECT),
            Map.entry("java/net/URL.openConnection", Permissions.NETWORK_CONNECT),
            Map.entry("java/net/URL.openStream", Permissions.NETWORK_CONNECT),
            Map.entry("java/nio/channels/SocketChannel.open", Permissions.NETWORK_CONNECT),
            Map.entry("java/io/FileOutputStream.<init>", Permissions.FILE_WRITE),
            Map.entry("java/io/FileWriter.<init>", Permissions.FILE_WRITE),
            Map.entry("java/io/RandomAccessFile.<init>", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.write", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.writeString", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.newOutputStream", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.newBufferedWriter", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.delete", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.deleteIfExists", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.move", Permissions.FILE_WRITE),
            Map.entry("java/nio/file/Files.createFile", Permissions.FILE_WRITE));

    /**
     * 扫描代码单元中的所有 jar 与 class 目录
     */
    public ScanReport scan(List<Path> sources) throws IOException {
        List<ScanReport.Finding> forbidden = new ArrayList<>();
        List<ScanReport.Finding> findings = new ArrayList<>();
        for (Path source : sources) {
            if (Files.isDirectory(source)) {
                scanDirectory(source, forbidden, findings);
            } else if (source.getFileName().toString().endsWith(".jar") && Files.isRegularFile(source)) {
                scanJar(source, forbidden, findings);
            }
        }
        Set<String> required = new LinkedHashSet<>();
        findings.forEach(f -> required.add(f.permission()));
        log.debug("Scanned {}: {} forbidden calls, permissions required {}", sources, forbidden.size(), required);
        return new ScanReport(forbidden, findings, required);
    }

    private void scanJar(Path jarFile, List<ScanReport.Finding> forbidden,
                         List<ScanReport.Finding> findings) throws IOException {
        try (JarFile jar = new JarFile(jarFile.toFile())) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (entry.getName().endsWith(".class")) {
                    try (InputStream is = jar.getInputStream(entry)) {
                        scanClass(is, forbidden, findings);
                    }
                }
            }
        }
    }

    private void scanDirectory(Path dir, List<ScanReport.Finding> forbidden,
                               List<ScanReport.Finding> findings) throws IOException {
        List<Path> classes;
        try (Stream<Path> walk = Files.walk(dir)) {
            classes = walk.filter(p -> p.getFileName().toString().endsWith(".class")).sorted().toList();
        }
        for (Path file : classes) {
            try (InputStream is = Files.newInputStream(file)) {
                scanClass(is, forbidden, findings);
            }
        }
    }

    private void scanClass(InputStream is, List<ScanReport.Finding> forbidden,
                           List<ScanReport.Finding> findings) throws IOException {
        ClassReader reader = new ClassReader(is);
        reader.accept(new ClassVisitor(Opcodes.ASM9) {

            private String currentClass;

            @Override
            public void visit(int version, int access, String name, String signature,
                              String superName, String[] interfaces) {
                this.currentClass = name.replace('/', '.');
            }

            @Override
            public MethodVisitor visitMethod(int access, String name, String descriptor,
                                             String signature, String[] exceptions) {
                return new MethodVisitor(Opcodes.ASM9) {
                    @Override
                    public void visitMethodInsn(int opcode, String owner, String methodName,
                                                String desc, boolean isInterface) {
                        String fullMethod = owner + "." + methodName + desc;
                        if (FORBIDDEN_METHODS.contains(fullMethod)) {
                            forbidden.add(new ScanReport.Finding(currentClass, fullMethod, null));
                            return;
                        }
                        String permission = PERMISSION_METHODS.get(owner + "." + methodName);
                        if (permission != null) {
                            findings.add(new ScanReport.Finding(currentClass, fullMethod, permission));
                        }
                    }
                };
            }
        }, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
    }
}
