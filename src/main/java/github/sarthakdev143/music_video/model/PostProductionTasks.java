package github.sarthakdev143.music_video.model;

public record PostProductionTasks(
        TaskStatus vfx,
        TaskStatus color,
        TaskStatus stabilization) {

    public PostProductionTasks {
        vfx = vfx == null ? TaskStatus.IDLE : vfx;
        color = color == null ? TaskStatus.IDLE : color;
        stabilization = stabilization == null ? TaskStatus.IDLE : stabilization;
    }

    public static PostProductionTasks idle() {
        return new PostProductionTasks(TaskStatus.IDLE, TaskStatus.IDLE, TaskStatus.IDLE);
    }

    public TaskStatus statusOf(PostProductionTask task) {
        return switch (task) {
            case VFX -> vfx;
            case COLOR -> color;
            case STABILIZATION -> stabilization;
        };
    }

    public PostProductionTasks with(PostProductionTask task, TaskStatus status) {
        return switch (task) {
            case VFX -> new PostProductionTasks(status, color, stabilization);
            case COLOR -> new PostProductionTasks(vfx, status, stabilization);
            case STABILIZATION -> new PostProductionTasks(vfx, color, status);
        };
    }
}
